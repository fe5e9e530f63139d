package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.OrderStatusHistory;
import com.marketplace.dispatch.repository.OrderStatusHistoryRepository;
import com.marketplace.shared.enums.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Applies order status changes and appends the matching audit row. Callers
 * run inside their own transaction with the order row locked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusRecorder {

    private final OrderStatusHistoryRepository historyRepository;
    private final Clock clock;

    /**
     * Moves the order to {@code target}. Returns false (and writes nothing)
     * when the order is already there.
     */
    public boolean transition(CustomerOrder order, OrderStatus target) {
        OrderStatus from = order.getStatus();
        if (from == target) {
            return false;
        }
        order.setStatus(target);
        append(order, target);
        log.debug("Order {} status {} -> {}", order.getId(), from, target);
        return true;
    }

    /** Audit row for a freshly persisted order. */
    public void recordInitial(CustomerOrder order) {
        append(order, order.getStatus());
    }

    private void append(CustomerOrder order, OrderStatus status) {
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .status(status)
                .timestamp(clock.instant())
                .build());
    }
}
