package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.CreateOrderRequest;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.dispatch.repository.DispatchStateRepository;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.SuggestionStatus;
import com.marketplace.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Customer side of the order lifecycle before a driver is assigned.
 *
 * Orders arrive PENDING from checkout, are released to the dispatcher once the
 * seller (or the checkout flow for rides and parcels) is ready, and can be
 * cancelled until a driver accepts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderIntakeService {

    private static final Set<OrderStatus> CANCELLABLE = EnumSet.of(
            OrderStatus.PENDING, OrderStatus.SEARCHING_FOR_DRIVER, OrderStatus.DRIVER_NOTIFICATION_SENT);

    private final CustomerOrderRepository orderRepository;
    private final DispatchStateRepository stateRepository;
    private final DriverSuggestionRepository suggestionRepository;
    private final OrderStatusRecorder statusRecorder;
    private final DispatchEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Transactional
    public OrderResponse createOrder(CreateOrderRequest req, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<CustomerOrder> existing = orderRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotent replay for key {}", idempotencyKey);
                metrics.recordIdempotentReplay();
                return OrderResponse.from(existing.get());
            }
        }

        CustomerOrder order = CustomerOrder.builder()
                .customerId(req.getCustomerId())
                .serviceType(req.getServiceType())
                .status(OrderStatus.PENDING)
                .pickupLat(req.getPickupLat())
                .pickupLng(req.getPickupLng())
                .dropoffLat(req.getDropoffLat())
                .dropoffLng(req.getDropoffLng())
                .requestedVehicleType(req.getRequestedVehicleType())
                .quotedDistanceKm(req.getQuotedDistanceKm())
                .quotedPrice(req.getQuotedPrice())
                .idempotencyKey(idempotencyKey)
                .build();

        order = orderRepository.save(order);
        statusRecorder.recordInitial(order);

        metrics.recordOrderCreated();
        log.info("Order {} created: {} for customer {}", order.getId(), order.getServiceType(), order.getCustomerId());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse releaseForDispatch(UUID orderId) {
        CustomerOrder order = lockOrder(orderId);
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new DispatchException(DispatchError.INVALID_STATE,
                    "Order " + orderId + " is " + order.getStatus() + ", expected PENDING");
        }
        statusRecorder.transition(order, OrderStatus.SEARCHING_FOR_DRIVER);
        eventPublisher.publish(KafkaTopics.ORDER_STATUS_CHANGED, order, "RELEASED_FOR_DISPATCH", 0);
        log.info("Order {} released for dispatch", orderId);
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse cancelOrder(UUID orderId, String customerId) {
        Instant now = clock.instant();
        CustomerOrder order = lockOrder(orderId);
        if (!order.getCustomerId().equals(customerId)) {
            // Other customers' orders are indistinguishable from missing ones
            throw new DispatchException(DispatchError.ORDER_NOT_FOUND, "Order " + orderId + " not found");
        }
        if (!CANCELLABLE.contains(order.getStatus())) {
            throw new DispatchException(DispatchError.INVALID_STATE,
                    "Order " + orderId + " is " + order.getStatus() + " and can no longer be cancelled");
        }

        statusRecorder.transition(order, OrderStatus.CANCELLED);
        suggestionRepository.findByCustomerOrderIdAndStatus(orderId, SuggestionStatus.SENT)
                .forEach(s -> s.close(SuggestionStatus.EXPIRED, now));
        int cycle = stateRepository.lockByOrderId(orderId)
                .map(state -> {
                    state.setActive(false);
                    return state.getCycle();
                })
                .orElse(0);

        eventPublisher.publish(KafkaTopics.ORDER_CANCELLED, order, "CUSTOMER_CANCELLED", cycle);
        metrics.recordOrderCancelled();
        log.info("Order {} cancelled by customer {}", orderId, customerId);
        return OrderResponse.from(order);
    }

    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .map(OrderResponse::from)
                .orElseThrow(() -> new DispatchException(DispatchError.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found"));
    }

    private CustomerOrder lockOrder(UUID orderId) {
        return orderRepository.lockById(orderId)
                .orElseThrow(() -> new DispatchException(DispatchError.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found"));
    }
}
