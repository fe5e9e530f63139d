package com.marketplace.dispatch.service;

import com.marketplace.dispatch.config.DispatchProperties;
import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DispatchState;
import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.CycleOutcome;
import com.marketplace.dispatch.model.DriverCandidate;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.dispatch.repository.DispatchStateRepository;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.SuggestionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * One dispatch loop pass over one order, in its own transaction.
 *
 * Locks the order row, then its dispatch state row, and then:
 *  1. state inactive                    -> skip
 *  2. retry back-off still running      -> skip
 *  3. a live offer is outstanding       -> skip
 *  4. cycle limit reached               -> deactivate, report EXHAUSTED
 *  5. rank candidates, excluding every driver ever offered this order
 *  6. nobody left                       -> back off for retryDelay, cycle unchanged
 *  7. open cycle N+1: expire lapsed offers of earlier cycles, then offer
 *     the top suggestionLimit drivers
 *
 * Nothing outside the database is touched here; the caller runs timers and
 * notifications once the transaction has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchCycleProcessor {

    private final CustomerOrderRepository orderRepository;
    private final DispatchStateRepository stateRepository;
    private final DriverSuggestionRepository suggestionRepository;
    private final DriverCandidateService candidateService;
    private final OrderStatusRecorder statusRecorder;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CycleOutcome process(UUID orderId) {
        Instant now = clock.instant();

        CustomerOrder order = orderRepository.tryLockById(orderId).orElse(null);
        if (order == null || order.isAssigned() || !order.getStatus().isDispatchable()) {
            log.debug("Order {} left the dispatch pool before it was locked", orderId);
            return CycleOutcome.skipped(orderId);
        }

        DispatchState state = stateRepository.lockByOrderId(orderId)
                .orElseGet(() -> stateRepository.save(DispatchState.initial(orderId)));

        if (!state.isActive()) {
            return CycleOutcome.skipped(orderId);
        }
        if (state.getNextRetryAt() != null && state.getNextRetryAt().isAfter(now)) {
            return CycleOutcome.skipped(orderId);
        }
        if (suggestionRepository.existsByCustomerOrderIdAndStatusAndExpiresAtAfter(
                orderId, SuggestionStatus.SENT, now)) {
            return CycleOutcome.skipped(orderId);
        }

        if (state.getCycle() >= properties.getMaxCycles()) {
            state.setActive(false);
            log.warn("Order {} exhausted {} dispatch cycles without acceptance, deactivating",
                    orderId, state.getCycle());
            return CycleOutcome.exhausted(order, state.getCycle());
        }

        Set<String> alreadyOffered = suggestionRepository.findOfferedDriverIds(orderId);
        List<DriverCandidate> candidates = candidateService.selectCandidates(order, alreadyOffered);

        if (candidates.isEmpty()) {
            state.setNextRetryAt(now.plus(properties.retryDelay()));
            log.info("No eligible drivers for order {} (cycle {}), retrying after {}s",
                    orderId, state.getCycle(), properties.getRetryDelaySeconds());
            return CycleOutcome.noCandidates(order, state.getCycle());
        }

        int cycle = state.getCycle() + 1;
        Instant expiresAt = now.plus(properties.acceptanceWindow());

        // Lapsed offers of earlier cycles; their timers no-op once the cycle moves on
        List<DriverSuggestion> lapsed = suggestionRepository.findByCustomerOrderIdAndStatus(orderId, SuggestionStatus.SENT);
        if (!lapsed.isEmpty()) {
            lapsed.forEach(s -> s.close(SuggestionStatus.EXPIRED, now));
            metrics.recordOffersExpired(lapsed.size());
        }

        List<DriverCandidate> selected = candidates.subList(0, Math.min(properties.getSuggestionLimit(), candidates.size()));
        List<DriverSuggestion> offers = selected.stream()
                .map(c -> DriverSuggestion.builder()
                        .customerOrder(order)
                        .driverId(c.getDriverId())
                        .cycle(cycle)
                        .distanceKm(c.getDistanceKm())
                        .status(SuggestionStatus.SENT)
                        .notifiedAt(now)
                        .expiresAt(expiresAt)
                        .build())
                .toList();
        suggestionRepository.saveAll(offers);

        state.setCycle(cycle);
        state.setLastDispatchedAt(now);
        state.setNextRetryAt(now.plus(properties.retryDelay()));

        statusRecorder.transition(order, OrderStatus.DRIVER_NOTIFICATION_SENT);

        List<String> driverIds = selected.stream().map(DriverCandidate::getDriverId).toList();
        log.info("Order {} cycle {}/{}: offered to {} drivers {}",
                orderId, cycle, properties.getMaxCycles(), driverIds.size(), driverIds);
        return CycleOutcome.offered(order, cycle, driverIds, now, expiresAt);
    }
}
