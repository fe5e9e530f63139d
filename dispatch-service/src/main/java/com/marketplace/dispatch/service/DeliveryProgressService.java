package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Progress reported by the assigned driver after acceptance:
 * ACCEPTED -> ON_THE_WAY -> DELIVERED -> COMPLETED, one step at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryProgressService {

    private static final Map<OrderStatus, OrderStatus> NEXT = Map.of(
            OrderStatus.ACCEPTED, OrderStatus.ON_THE_WAY,
            OrderStatus.ON_THE_WAY, OrderStatus.DELIVERED,
            OrderStatus.DELIVERED, OrderStatus.COMPLETED);

    private final CustomerOrderRepository orderRepository;
    private final OrderStatusRecorder statusRecorder;
    private final DispatchEventPublisher eventPublisher;

    @Transactional
    public OrderResponse advance(UUID orderId, String driverId, OrderStatus target) {
        CustomerOrder order = orderRepository.lockById(orderId)
                .filter(o -> driverId.equals(o.getAssignedDriverId()))
                .orElseThrow(() -> new DispatchException(DispatchError.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found among orders assigned to driver " + driverId));

        OrderStatus current = order.getStatus();
        if (NEXT.get(current) != target) {
            throw new DispatchException(DispatchError.INVALID_STATUS_TRANSITION,
                    "Cannot move order " + orderId + " from " + current + " to " + target);
        }

        statusRecorder.transition(order, target);
        eventPublisher.publish(KafkaTopics.ORDER_STATUS_CHANGED, order, null, 0);
        log.info("Order {} moved {} -> {} by driver {}", orderId, current, target, driverId);
        return OrderResponse.from(order);
    }
}
