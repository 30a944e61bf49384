package com.starscape.bracketflow.features.dispatch.app;

import com.starscape.bracketflow.common.config.DispatchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchConfig {
    
    @Bean
    public AdmissionGate admissionGate(DispatchProperties dispatchProperties) {
        return new AdmissionGate(dispatchProperties.getMaxConcurrency());
    }
}
