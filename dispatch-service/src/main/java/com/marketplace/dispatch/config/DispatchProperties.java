package com.marketplace.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Dispatch tuning knobs, bound from the {@code dispatch.*} namespace.
 *
 * <pre>
 * dispatch:
 *   suggestion-limit: 5             # drivers offered per cycle
 *   acceptance-window-seconds: 60   # lifetime of one offer
 *   max-cycles: 3                   # broadcast cycles before the order is given up
 *   retry-delay-seconds: 10         # back-off after an empty candidate pool or a broadcast
 *   location-staleness-seconds: 60  # older driver pings are ignored
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private int suggestionLimit = 5;
    private int acceptanceWindowSeconds = 60;
    private int maxCycles = 3;
    private int retryDelaySeconds = 10;
    private int locationStalenessSeconds = 60;

    private long loopIntervalMs = 5000;
    private long expiryPollMs = 1000;
    private long sweepIntervalMs = 15000;
    private int sweepGraceSeconds = 5;

    private boolean schedulingEnabled = true;

    public Duration acceptanceWindow() {
        return Duration.ofSeconds(acceptanceWindowSeconds);
    }

    public Duration retryDelay() {
        return Duration.ofSeconds(retryDelaySeconds);
    }

    public Duration locationStaleness() {
        return Duration.ofSeconds(locationStalenessSeconds);
    }

    public Duration sweepGrace() {
        return Duration.ofSeconds(sweepGraceSeconds);
    }
}
