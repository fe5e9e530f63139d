package com.marketplace.dispatch.config;

import com.marketplace.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the dispatch flags in Redis at startup and reports their effective
 * values, so an instance that comes up paused is visible in its boot log.
 *
 *   redis-cli HSET feature-flags:dispatch dispatch_kill_switch true
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureFlagInitializer implements ApplicationRunner {

    private final FeatureFlagService featureFlagService;

    @Override
    public void run(ApplicationArguments args) {
        featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);

        boolean paused = featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false);
        boolean push = featureFlagService.isEnabled(FeatureFlagService.OFFER_PUSH_ENABLED, true);
        if (paused) {
            log.warn("Dispatch starts PAUSED: {} is set for scope {}",
                    FeatureFlagService.DISPATCH_KILL_SWITCH, FeatureFlagService.DEFAULT_SCOPE);
        }
        log.info("Dispatch flags: kill_switch={} offer_push={}", paused, push);
    }
}
