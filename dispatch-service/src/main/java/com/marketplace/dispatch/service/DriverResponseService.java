package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DispatchState;
import com.marketplace.dispatch.entity.DriverProfile;
import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.model.SuggestedOrderResponse;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.dispatch.repository.DispatchStateRepository;
import com.marketplace.dispatch.repository.DriverProfileRepository;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.SuggestionStatus;
import com.marketplace.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Driver side of the offer protocol: accept, reject and the list of open offers.
 *
 * Accept and reject lock the order row for the whole transaction, so they
 * serialise with each other, with the dispatch loop and with offer expiry.
 * Of two drivers accepting the same order, the second one to get the lock
 * sees the order assigned and gets ORDER_ALREADY_ASSIGNED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverResponseService {

    private final CustomerOrderRepository orderRepository;
    private final DispatchStateRepository stateRepository;
    private final DriverSuggestionRepository suggestionRepository;
    private final DriverProfileRepository driverProfileRepository;
    private final DriverEligibilityPolicy eligibilityPolicy;
    private final OrderStatusRecorder statusRecorder;
    private final DispatchEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Transactional
    public OrderResponse acceptOrder(UUID orderId, String driverId) {
        Instant now = clock.instant();
        CustomerOrder order = lockOrder(orderId);

        if (order.isAssigned() && !order.getAssignedDriverId().equals(driverId)) {
            throw new DispatchException(DispatchError.ORDER_ALREADY_ASSIGNED,
                    "Order " + orderId + " was already accepted by another driver");
        }
        if (!order.getStatus().isDispatchable()) {
            throw new DispatchException(DispatchError.ORDER_NOT_FOUND,
                    "Order " + orderId + " is not available for acceptance");
        }
        if (driverId.equals(order.getCustomerId())) {
            throw new DispatchException(DispatchError.SELF_ASSIGNMENT_FORBIDDEN);
        }

        DriverProfile driver = driverProfileRepository.findById(driverId)
                .filter(DriverProfile::isApproved)
                .orElseThrow(() -> new DispatchException(DispatchError.DRIVER_NOT_APPROVED));
        if (!eligibilityPolicy.isEligible(driver, order)) {
            throw new DispatchException(DispatchError.DRIVER_NOT_ELIGIBLE,
                    "Driver " + driverId + " cannot serve " + order.getServiceType() + " order " + orderId);
        }

        DriverSuggestion offer = suggestionRepository
                .findFirstByCustomerOrderIdAndDriverIdAndStatus(orderId, driverId, SuggestionStatus.SENT)
                .filter(s -> s.isLive(now))
                .orElseThrow(() -> new DispatchException(DispatchError.NO_LIVE_OFFER));

        order.setAssignedDriverId(driverId);
        statusRecorder.transition(order, OrderStatus.ACCEPTED);
        offer.close(SuggestionStatus.ACCEPTED, now);

        // Competing offers of the order are void from here on
        suggestionRepository.findByCustomerOrderIdAndStatus(orderId, SuggestionStatus.SENT).stream()
                .filter(s -> !s.getId().equals(offer.getId()))
                .forEach(s -> s.close(SuggestionStatus.EXPIRED, now));

        stateRepository.lockByOrderId(orderId).ifPresent(s -> s.setActive(false));

        eventPublisher.publish(KafkaTopics.ORDER_ACCEPTED, order, null, offer.getCycle());
        metrics.recordOfferAccepted();
        log.info("Order {} accepted by driver {} (cycle {})", orderId, driverId, offer.getCycle());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse rejectOrder(UUID orderId, String driverId) {
        Instant now = clock.instant();
        CustomerOrder order = lockOrder(orderId);

        DriverSuggestion offer = suggestionRepository
                .findFirstByCustomerOrderIdAndDriverIdAndStatus(orderId, driverId, SuggestionStatus.SENT)
                .orElseThrow(() -> new DispatchException(DispatchError.OFFER_NOT_FOUND,
                        "Order " + orderId + " has no pending offer for driver " + driverId));

        if (!order.getStatus().isDispatchable()) {
            throw new DispatchException(DispatchError.INVALID_STATE,
                    "Order " + orderId + " is no longer in a rejectable state");
        }

        offer.close(SuggestionStatus.REJECTED, now);
        metrics.recordOfferRejected();
        log.info("Order {} rejected by driver {} (cycle {})", orderId, driverId, offer.getCycle());

        boolean othersPending = suggestionRepository
                .existsByCustomerOrderIdAndStatusAndExpiresAtAfter(orderId, SuggestionStatus.SENT, now);
        if (!othersPending && order.getStatus() == OrderStatus.DRIVER_NOTIFICATION_SENT) {
            statusRecorder.transition(order, OrderStatus.SEARCHING_FOR_DRIVER);
            DispatchState state = stateRepository.lockByOrderId(orderId)
                    .orElseGet(() -> stateRepository.save(DispatchState.initial(orderId)));
            state.setNextRetryAt(now);
            log.info("All offers for order {} answered negatively, re-queued for dispatch", orderId);
        }
        return OrderResponse.from(order);
    }

    /**
     * Live offers for the driver, newest order first. Empty for unknown or
     * unapproved drivers and for drivers that opted out of every service.
     */
    @Transactional(readOnly = true)
    public List<SuggestedOrderResponse> listSuggestedOrders(String driverId) {
        Optional<DriverProfile> driver = driverProfileRepository.findById(driverId)
                .filter(DriverProfile::isApproved);
        if (driver.isEmpty()) {
            return List.of();
        }
        Set<ServiceType> serviceTypes = eligibilityPolicy.acceptedServiceTypes(driver.get());
        if (serviceTypes.isEmpty()) {
            return List.of();
        }
        return suggestionRepository
                .findLiveOffersForDriver(driverId, clock.instant(), OrderStatus.DISPATCHABLE, serviceTypes)
                .stream()
                .map(SuggestedOrderResponse::from)
                .toList();
    }

    private CustomerOrder lockOrder(UUID orderId) {
        return orderRepository.lockById(orderId)
                .orElseThrow(() -> new DispatchException(DispatchError.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found"));
    }
}
