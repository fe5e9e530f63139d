package com.marketplace.dispatch.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the dispatch loop, the expiry drain and the sweeper.
 * Disabled in tests so that they drive every pass explicitly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "dispatch", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
