package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DispatchState;
import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.dispatch.repository.DispatchStateRepository;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.SuggestionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Closes the acceptance window of one dispatch cycle.
 *
 * No-op when the order is gone or assigned, when the dispatch state has moved
 * to another cycle, or when nothing of that cycle is still SENT. Otherwise all
 * SENT offers of the cycle become EXPIRED, the order drops back to
 * SEARCHING_FOR_DRIVER and the loop may retry it immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfferExpiryService {

    private final CustomerOrderRepository orderRepository;
    private final DispatchStateRepository stateRepository;
    private final DriverSuggestionRepository suggestionRepository;
    private final OrderStatusRecorder statusRecorder;
    private final DispatchMetrics metrics;
    private final Clock clock;

    /**
     * @return number of offers expired, 0 for a stale or duplicate firing
     */
    @Transactional
    public int expire(UUID orderId, int cycle) {
        Instant now = clock.instant();

        CustomerOrder order = orderRepository.tryLockById(orderId).orElse(null);
        if (order == null || order.isAssigned()) {
            return 0;
        }

        DispatchState state = stateRepository.lockByOrderId(orderId).orElse(null);
        if (state == null || state.getCycle() != cycle) {
            log.debug("Stale expiry for order {} cycle {} ignored", orderId, cycle);
            return 0;
        }

        List<DriverSuggestion> pending = suggestionRepository
                .findByCustomerOrderIdAndCycleAndStatus(orderId, cycle, SuggestionStatus.SENT);
        if (pending.isEmpty()) {
            return 0;
        }

        pending.forEach(s -> s.close(SuggestionStatus.EXPIRED, now));

        if (order.getStatus() == OrderStatus.DRIVER_NOTIFICATION_SENT) {
            statusRecorder.transition(order, OrderStatus.SEARCHING_FOR_DRIVER);
        }
        state.setNextRetryAt(now);

        metrics.recordOffersExpired(pending.size());
        log.info("Expired {} unanswered offers for order {} cycle {}", pending.size(), orderId, cycle);
        return pending.size();
    }
}
