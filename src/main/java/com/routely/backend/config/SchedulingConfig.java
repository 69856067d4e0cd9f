package com.routely.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Periodic network rebuilds. Switched off with {@code routely.scheduling.enabled=false},
 * e.g. for instances that only rebuild on the admin endpoint.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "routely.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
