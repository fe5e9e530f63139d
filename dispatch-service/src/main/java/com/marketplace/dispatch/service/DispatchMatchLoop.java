package com.marketplace.dispatch.service;

import com.marketplace.dispatch.config.DispatchProperties;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.CycleOutcome;
import com.marketplace.dispatch.notification.DriverNotifier;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.featureflag.FeatureFlagService;
import com.marketplace.shared.util.KafkaTopics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Periodic driver of the dispatch protocol. Each tick walks every unassigned
 * order waiting for a driver and hands it to {@link DispatchCycleProcessor},
 * one transaction per order. After each commit it arms the expiry timer and
 * pushes the offers.
 *
 * Ops can pause the loop instantly with the {@code dispatch_kill_switch} flag.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchMatchLoop {

    private final CustomerOrderRepository orderRepository;
    private final DispatchCycleProcessor cycleProcessor;
    private final OfferExpiryScheduler expiryScheduler;
    private final DriverNotifier driverNotifier;
    private final DispatchEventPublisher eventPublisher;
    private final FeatureFlagService featureFlagService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    @Scheduled(fixedDelayString = "${dispatch.loop-interval-ms:5000}")
    public void scheduledPass() {
        runOnce();
    }

    /**
     * Runs a single pass and returns what happened to each order it looked at.
     */
    public List<CycleOutcome> runOnce() {
        if (killSwitchActive()) {
            metrics.recordKillSwitchSkip();
            log.info("Dispatch kill switch active, skipping loop pass");
            return List.of();
        }
        Timer.Sample sample = Timer.start();
        try {
            return processOpenOrders();
        } finally {
            sample.stop(metrics.getLoopPassTimer());
        }
    }

    private List<CycleOutcome> processOpenOrders() {
        List<UUID> orderIds = orderRepository.findUnassignedIdsByStatusIn(OrderStatus.DISPATCHABLE);
        List<CycleOutcome> outcomes = new ArrayList<>(orderIds.size());

        for (UUID orderId : orderIds) {
            CycleOutcome outcome;
            try {
                outcome = cycleProcessor.process(orderId);
            } catch (PessimisticLockingFailureException e) {
                metrics.recordLockTimeout();
                log.info("Order {} is locked by another actor, retrying next tick", orderId);
                continue;
            } catch (RuntimeException e) {
                log.error("Dispatch pass failed for order {}, continuing with the rest", orderId, e);
                continue;
            }
            afterCommit(outcome);
            outcomes.add(outcome);
        }

        if (!orderIds.isEmpty()) {
            log.debug("Dispatch pass processed {} open orders", orderIds.size());
        }
        return outcomes;
    }

    private void afterCommit(CycleOutcome outcome) {
        switch (outcome.kind()) {
            case OFFERED -> {
                metrics.recordCycleOffered(outcome.offeredDriverIds().size());
                try {
                    expiryScheduler.schedule(outcome.cycleKey(), properties.acceptanceWindow());
                } catch (RuntimeException e) {
                    // ExpiredOfferSweeper picks the cycle up once it is overdue
                    log.warn("Could not arm expiry timer for order {} cycle {}", outcome.orderId(), outcome.cycle(), e);
                }
                try {
                    driverNotifier.notifyDrivers(outcome.order(), outcome.cycle(), outcome.offeredDriverIds(),
                            outcome.offeredAt(), outcome.expiresAt());
                } catch (RuntimeException e) {
                    // offers are already persisted; drivers still see them when they poll
                    log.warn("Could not notify drivers for order {} cycle {}", outcome.orderId(), outcome.cycle(), e);
                }
            }
            case EXHAUSTED -> {
                metrics.recordExhausted();
                try {
                    eventPublisher.publish(KafkaTopics.ORDER_DISPATCH_EXHAUSTED, outcome.order(),
                            "MAX_CYCLES_REACHED", outcome.cycle());
                } catch (RuntimeException e) {
                    log.warn("Could not publish exhaustion of order {}", outcome.orderId(), e);
                }
            }
            case NO_CANDIDATES -> metrics.recordNoCandidates();
            case SKIPPED -> { }
        }
    }

    private boolean killSwitchActive() {
        try {
            return featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false);
        } catch (RuntimeException e) {
            log.warn("Feature flag store unreachable, dispatching as usual: {}", e.getMessage());
            return false;
        }
    }
}
