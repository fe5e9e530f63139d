package com.marketplace.dispatch.service;

import com.marketplace.dispatch.config.DispatchProperties;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.OfferCycleKey;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Polls for dispatch cycles whose offers are overdue by more than the sweep
 * grace period and expires them. Catches timers lost on the Redis side.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredOfferSweeper {

    private final DriverSuggestionRepository suggestionRepository;
    private final OfferExpiryService expiryService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.sweep-interval-ms:15000}")
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.sweepGrace());
        List<OfferCycleKey> overdue = suggestionRepository.findOverdueCycles(cutoff);

        int expired = 0;
        for (OfferCycleKey key : overdue) {
            try {
                expired += expiryService.expire(key.orderId(), key.cycle());
            } catch (PessimisticLockingFailureException e) {
                metrics.recordLockTimeout();
                log.info("Order {} busy, sweeping cycle {} next time", key.orderId(), key.cycle());
            } catch (RuntimeException e) {
                log.error("Sweep of order {} cycle {} failed", key.orderId(), key.cycle(), e);
            }
        }

        if (expired > 0) {
            log.warn("Sweeper expired {} overdue offers across {} cycles; expiry timers were missed",
                    expired, overdue.size());
        }
        return expired;
    }
}
