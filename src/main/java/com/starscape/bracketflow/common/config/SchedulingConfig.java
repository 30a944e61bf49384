package com.starscape.bracketflow.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Scheduled tasks (event stream heartbeats).
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
