package com.starscape.bracketflow;

import com.starscape.bracketflow.common.config.DispatchProperties;
import com.starscape.bracketflow.common.config.GroupingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({GroupingProperties.class, DispatchProperties.class})
public class BracketFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(BracketFlowApplication.class, args);
    }
}
