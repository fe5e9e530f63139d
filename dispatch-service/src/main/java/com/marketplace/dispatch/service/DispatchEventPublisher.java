package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.events.OrderStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes order lifecycle events keyed by order id, so that all events of
 * one order land on the same partition in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publish(String topic, CustomerOrder order, String reason, int cycle) {
        publish(topic, order.getId(), order.getCustomerId(), order.getAssignedDriverId(),
                order.getStatus(), reason, cycle);
    }

    public void publish(String topic, UUID orderId, String customerId, String driverId,
                        OrderStatus status, String reason, int cycle) {
        OrderStatusChangedEvent event = OrderStatusChangedEvent.builder()
                .orderId(orderId.toString())
                .customerId(customerId)
                .driverId(driverId)
                .status(status)
                .reason(reason)
                .dispatchCycle(cycle)
                .changedAt(clock.instant())
                .build();
        kafkaTemplate.send(topic, orderId.toString(), event);
        log.debug("Published {} for order {} (status={})", topic, orderId, status);
    }
}
