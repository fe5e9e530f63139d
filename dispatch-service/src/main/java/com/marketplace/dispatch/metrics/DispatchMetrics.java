package com.marketplace.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Dispatch Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_orders_total{status="created|duplicate|cancelled"}
 *   dispatch_cycles_total{outcome="offered|no_candidates|exhausted"}
 *   dispatch_offers_sent_total
 *   dispatch_offer_response_total{outcome="accepted|rejected|expired"}
 *   dispatch_notification_failures_total
 *   dispatch_loop_pass_seconds{quantile="0.5|0.95|0.99"}
 *   dispatch_lock_timeouts_total
 *   dispatch_kill_switch_skips_total
 */
@Component
public class DispatchMetrics {

    private final Counter orderCreatedCounter;
    private final Counter idempotentReplayCounter;
    private final Counter orderCancelledCounter;
    private final Counter cycleOfferedCounter;
    private final Counter noCandidatesCounter;
    private final Counter exhaustedCounter;
    private final Counter offersSentCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerRejectedCounter;
    private final Counter offerExpiredCounter;
    private final Counter notificationFailureCounter;
    private final Counter lockTimeoutCounter;
    private final Counter killSwitchCounter;
    private final Timer   loopPassTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.orderCreatedCounter = Counter.builder("dispatch.orders")
                .tag("status", "created")
                .description("Orders received from checkout")
                .register(registry);

        this.idempotentReplayCounter = Counter.builder("dispatch.orders")
                .tag("status", "duplicate")
                .description("Idempotent replay requests (same key)")
                .register(registry);

        this.orderCancelledCounter = Counter.builder("dispatch.orders")
                .tag("status", "cancelled")
                .description("Orders cancelled by the customer before acceptance")
                .register(registry);

        this.cycleOfferedCounter = Counter.builder("dispatch.cycles")
                .tag("outcome", "offered")
                .description("Dispatch cycles that broadcast at least one offer")
                .register(registry);

        this.noCandidatesCounter = Counter.builder("dispatch.cycles")
                .tag("outcome", "no_candidates")
                .description("Loop passes that found no eligible driver")
                .register(registry);

        this.exhaustedCounter = Counter.builder("dispatch.cycles")
                .tag("outcome", "exhausted")
                .description("Orders deactivated after reaching the cycle limit")
                .register(registry);

        this.offersSentCounter = Counter.builder("dispatch.offers.sent")
                .description("Individual driver offers created")
                .register(registry);

        this.offerAcceptedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "accepted")
                .description("Driver offers accepted")
                .register(registry);

        this.offerRejectedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "rejected")
                .description("Driver offers rejected")
                .register(registry);

        this.offerExpiredCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "expired")
                .description("Driver offers that lapsed without an answer")
                .register(registry);

        this.notificationFailureCounter = Counter.builder("dispatch.notification.failures")
                .description("Offer notifications that could not be handed to the broker")
                .register(registry);

        this.lockTimeoutCounter = Counter.builder("dispatch.lock_timeouts")
                .description("Loop or expiry passes skipped because the order row was busy")
                .register(registry);

        this.killSwitchCounter = Counter.builder("dispatch.kill_switch_skips")
                .description("Loop ticks skipped because the dispatch kill switch was active")
                .register(registry);

        // p50, p95, p99 histogram published to Prometheus
        this.loopPassTimer = Timer.builder("dispatch.loop.pass")
                .description("Duration of one full dispatch loop pass over all open orders")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(registry);
    }

    public void recordOrderCreated()             { orderCreatedCounter.increment(); }
    public void recordIdempotentReplay()         { idempotentReplayCounter.increment(); }
    public void recordOrderCancelled()           { orderCancelledCounter.increment(); }
    public void recordCycleOffered(int offers)   { cycleOfferedCounter.increment(); offersSentCounter.increment(offers); }
    public void recordNoCandidates()             { noCandidatesCounter.increment(); }
    public void recordExhausted()                { exhaustedCounter.increment(); }
    public void recordOfferAccepted()            { offerAcceptedCounter.increment(); }
    public void recordOfferRejected()            { offerRejectedCounter.increment(); }
    public void recordOffersExpired(int count)   { offerExpiredCounter.increment(count); }
    public void recordNotificationFailure()      { notificationFailureCounter.increment(); }
    public void recordLockTimeout()              { lockTimeoutCounter.increment(); }
    public void recordKillSwitchSkip()           { killSwitchCounter.increment(); }
    public Timer getLoopPassTimer()              { return loopPassTimer; }
}
