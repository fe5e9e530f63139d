package com.marketplace.dispatch.integration;

import com.marketplace.dispatch.DispatchServiceApplication;
import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DispatchState;
import com.marketplace.dispatch.entity.DriverLocation;
import com.marketplace.dispatch.entity.DriverProfile;
import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.dispatch.entity.OrderStatusHistory;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.model.CreateOrderRequest;
import com.marketplace.dispatch.model.CycleOutcome;
import com.marketplace.dispatch.model.OfferCycleKey;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.model.SuggestedOrderResponse;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.dispatch.repository.DispatchStateRepository;
import com.marketplace.dispatch.repository.DriverLocationRepository;
import com.marketplace.dispatch.repository.DriverProfileRepository;
import com.marketplace.dispatch.repository.DriverSuggestionRepository;
import com.marketplace.dispatch.repository.OrderStatusHistoryRepository;
import com.marketplace.dispatch.service.DispatchMatchLoop;
import com.marketplace.dispatch.service.DriverResponseService;
import com.marketplace.dispatch.service.ExpiredOfferSweeper;
import com.marketplace.dispatch.service.OfferExpiryScheduler;
import com.marketplace.dispatch.service.OfferExpiryService;
import com.marketplace.dispatch.service.OrderIntakeService;
import com.marketplace.shared.enums.DriverApprovalStatus;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.SuggestionStatus;
import com.marketplace.shared.enums.VehicleType;
import com.marketplace.shared.events.DispatchOfferSentEvent;
import com.marketplace.shared.featureflag.FeatureFlagService;
import com.marketplace.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Full dispatch protocol against real JPA row locks on H2.
 *
 * Redis, Redisson and Kafka are replaced by mocks; the loop and the expiry
 * worker are driven by hand with a controllable clock.
 */
@SpringBootTest(classes = DispatchServiceApplication.class,
        properties = "dispatch.suggestion-limit=2")
@ActiveProfiles("test")
class DispatchProtocolIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final double PICKUP_LAT = 41.3000;
    private static final double PICKUP_LNG = 69.2400;

    // ── Infrastructure mocks ─────────────────────────────────────────────
    @MockBean private RedissonClient redissonClient;
    @MockBean private KafkaTemplate<String, Object> kafkaTemplate;
    @MockBean private FeatureFlagService featureFlagService;
    @MockBean private OfferExpiryScheduler expiryScheduler;
    @MockBean private Clock clock;

    @Autowired private DispatchMatchLoop matchLoop;
    @Autowired private OfferExpiryService expiryService;
    @Autowired private ExpiredOfferSweeper sweeper;
    @Autowired private DriverResponseService responseService;
    @Autowired private OrderIntakeService intakeService;

    @Autowired private CustomerOrderRepository orderRepository;
    @Autowired private DispatchStateRepository stateRepository;
    @Autowired private DriverSuggestionRepository suggestionRepository;
    @Autowired private OrderStatusHistoryRepository historyRepository;
    @Autowired private DriverProfileRepository profileRepository;
    @Autowired private DriverLocationRepository locationRepository;

    private volatile Instant now;

    @BeforeEach
    void setUp() {
        historyRepository.deleteAll();
        suggestionRepository.deleteAll();
        stateRepository.deleteAll();
        orderRepository.deleteAll();
        locationRepository.deleteAll();
        profileRepository.deleteAll();

        now = T0;
        given(clock.instant()).willAnswer(inv -> now);
        given(featureFlagService.isEnabled(anyString(), anyBoolean()))
                .willAnswer(inv -> inv.getArgument(1));
        given(kafkaTemplate.send(anyString(), anyString(), any()))
                .willReturn(new CompletableFuture<>());
    }

    @Test
    @DisplayName("One pass with three eligible drivers offers the two nearest and opens cycle 1")
    void firstPassOffersNearestDrivers() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");

        List<CycleOutcome> outcomes = matchLoop.runOnce();

        assertThat(outcomes).singleElement()
                .extracting(CycleOutcome::kind).isEqualTo(CycleOutcome.Kind.OFFERED);

        List<DriverSuggestion> offers = suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId);
        assertThat(offers).extracting(DriverSuggestion::getDriverId).containsExactly("drv-1", "drv-2");
        assertThat(offers).allSatisfy(s -> {
            assertThat(s.getStatus()).isEqualTo(SuggestionStatus.SENT);
            assertThat(s.getCycle()).isEqualTo(1);
            assertThat(s.getExpiresAt()).isEqualTo(T0.plusSeconds(60));
        });
        assertThat(offers.get(0).getDistanceKm()).isLessThan(offers.get(1).getDistanceKm());

        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.DRIVER_NOTIFICATION_SENT);
        assertThat(state(orderId).getCycle()).isEqualTo(1);
        assertThat(state(orderId).getLastDispatchedAt()).isEqualTo(T0);

        assertThat(historyRepository.findByOrderIdOrderByIdAsc(orderId))
                .extracting(OrderStatusHistory::getStatus)
                .containsExactly(OrderStatus.PENDING, OrderStatus.SEARCHING_FOR_DRIVER,
                        OrderStatus.DRIVER_NOTIFICATION_SENT);

        verify(expiryScheduler).schedule(new OfferCycleKey(orderId, 1), Duration.ofSeconds(60));
        verify(kafkaTemplate).send(eq(KafkaTopics.DRIVER_OFFER_SENT), eq("drv-1"), any(DispatchOfferSentEvent.class));
        verify(kafkaTemplate).send(eq(KafkaTopics.DRIVER_OFFER_SENT), eq("drv-2"), any(DispatchOfferSentEvent.class));
    }

    @Test
    @DisplayName("Loop is idempotent while a cycle is live")
    void loopDoesNothingWhileOffersAreLive() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(30);
        List<CycleOutcome> second = matchLoop.runOnce();

        assertThat(second).extracting(CycleOutcome::kind).containsExactly(CycleOutcome.Kind.SKIPPED);
        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId)).hasSize(2);
        assertThat(state(orderId).getCycle()).isEqualTo(1);
    }

    @Test
    @DisplayName("Rejecting one of two live offers keeps the order in DRIVER_NOTIFICATION_SENT")
    void rejectWhileAnotherOfferIsLive() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(5);
        responseService.rejectOrder(orderId, "drv-2");

        assertThat(suggestion(orderId, "drv-2").getStatus()).isEqualTo(SuggestionStatus.REJECTED);
        assertThat(suggestion(orderId, "drv-2").getRespondedAt()).isEqualTo(now);
        assertThat(suggestion(orderId, "drv-1").getStatus()).isEqualTo(SuggestionStatus.SENT);
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.DRIVER_NOTIFICATION_SENT);
    }

    @Test
    @DisplayName("Rejecting the last live offer re-queues the order immediately")
    void rejectLastLiveOfferRequeuesOrder() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(5);
        responseService.rejectOrder(orderId, "drv-1");
        responseService.rejectOrder(orderId, "drv-2");

        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.SEARCHING_FOR_DRIVER);
        assertThat(state(orderId).getNextRetryAt()).isEqualTo(now);

        // next pass reaches the third driver without waiting for the retry delay
        List<CycleOutcome> outcomes = matchLoop.runOnce();
        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.kind()).isEqualTo(CycleOutcome.Kind.OFFERED);
            assertThat(o.offeredDriverIds()).containsExactly("drv-3");
            assertThat(o.cycle()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Unanswered offers expire, the order reverts and may be retried at once")
    void offersExpire() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(60);
        int expired = expiryService.expire(orderId, 1);

        assertThat(expired).isEqualTo(2);
        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId))
                .extracting(DriverSuggestion::getStatus)
                .containsOnly(SuggestionStatus.EXPIRED);
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.SEARCHING_FOR_DRIVER);
        assertThat(state(orderId).getNextRetryAt()).isEqualTo(now);

        // a duplicate or late timer is a no-op
        assertThat(expiryService.expire(orderId, 1)).isZero();
        assertThat(historyRepository.findByOrderIdOrderByIdAsc(orderId))
                .extracting(OrderStatusHistory::getStatus)
                .containsExactly(OrderStatus.PENDING, OrderStatus.SEARCHING_FOR_DRIVER,
                        OrderStatus.DRIVER_NOTIFICATION_SENT, OrderStatus.SEARCHING_FOR_DRIVER);
    }

    @Test
    @DisplayName("Expiry for a superseded cycle does nothing")
    void staleCycleExpiryIsIgnored() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        assertThat(expiryService.expire(orderId, 7)).isZero();
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.DRIVER_NOTIFICATION_SENT);
    }

    @Test
    @DisplayName("Sweeper expires a cycle whose timer never fired once the grace period has passed")
    void sweeperCatchesLostTimers() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(62);
        assertThat(sweeper.sweep()).isZero();

        now = T0.plusSeconds(66);
        assertThat(sweeper.sweep()).isEqualTo(2);
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.SEARCHING_FOR_DRIVER);
    }

    @Test
    @Timeout(30)
    @DisplayName("Two drivers accepting concurrently, exactly one wins and the other gets a conflict")
    void concurrentAccepts() throws Exception {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();
        now = T0.plusSeconds(10);

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<OrderResponse>> results = new ArrayList<>();
            for (String driverId : List.of("drv-1", "drv-2")) {
                Callable<OrderResponse> accept = () -> {
                    start.await();
                    return responseService.acceptOrder(orderId, driverId);
                };
                results.add(pool.submit(accept));
            }
            start.countDown();

            int succeeded = 0;
            List<DispatchException> failures = new ArrayList<>();
            for (Future<OrderResponse> result : results) {
                try {
                    result.get(20, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(DispatchException.class);
                    failures.add((DispatchException) e.getCause());
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(failures).singleElement()
                    .extracting(DispatchException::getError)
                    .isEqualTo(DispatchError.ORDER_ALREADY_ASSIGNED);
        } finally {
            pool.shutdownNow();
        }

        CustomerOrder order = order(orderId);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.ACCEPTED);
        List<DriverSuggestion> offers = suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId);
        assertThat(offers).filteredOn(s -> s.getStatus() == SuggestionStatus.ACCEPTED)
                .singleElement()
                .extracting(DriverSuggestion::getDriverId)
                .isEqualTo(order.getAssignedDriverId());
        assertThat(offers).filteredOn(s -> s.getStatus() == SuggestionStatus.SENT).isEmpty();
        assertThat(state(orderId).isActive()).isFalse();
        verify(kafkaTemplate).send(eq(KafkaTopics.ORDER_ACCEPTED), eq(orderId.toString()), any());
    }

    @Test
    @DisplayName("After three unanswered cycles the fourth pass deactivates the order despite free drivers")
    void cycleLimitDeactivatesOrder() {
        foodDrivers(7);
        UUID orderId = releasedFoodOrder("cust-1");

        for (int cycle = 1; cycle <= 3; cycle++) {
            List<CycleOutcome> outcomes = matchLoop.runOnce();
            assertThat(outcomes).singleElement()
                    .extracting(CycleOutcome::kind).isEqualTo(CycleOutcome.Kind.OFFERED);
            advance(Duration.ofSeconds(61));
        }

        List<CycleOutcome> fourth = matchLoop.runOnce();

        assertThat(fourth).singleElement()
                .extracting(CycleOutcome::kind).isEqualTo(CycleOutcome.Kind.EXHAUSTED);
        assertThat(state(orderId).isActive()).isFalse();
        assertThat(state(orderId).getCycle()).isEqualTo(3);
        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId))
                .hasSize(6)
                .extracting(DriverSuggestion::getDriverId)
                .doesNotContain("drv-7");
        verify(kafkaTemplate).send(eq(KafkaTopics.ORDER_DISPATCH_EXHAUSTED), eq(orderId.toString()), any());

        advance(Duration.ofSeconds(61));
        assertThat(matchLoop.runOnce()).extracting(CycleOutcome::kind)
                .containsExactly(CycleOutcome.Kind.SKIPPED);
        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId)).hasSize(6);
    }

    @Test
    @DisplayName("Cycle counter does not move while no driver is available")
    void emptyPoolBacksOffWithoutConsumingCycles() {
        UUID orderId = releasedFoodOrder("cust-1");

        List<CycleOutcome> outcomes = matchLoop.runOnce();

        assertThat(outcomes).extracting(CycleOutcome::kind).containsExactly(CycleOutcome.Kind.NO_CANDIDATES);
        assertThat(state(orderId).getCycle()).isZero();
        assertThat(state(orderId).getNextRetryAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.SEARCHING_FOR_DRIVER);
        verify(expiryScheduler, never()).schedule(any(), any());
    }

    @Test
    @DisplayName("A driver cannot accept their own order even with a live offer")
    void selfAssignmentForbidden() {
        saveDriver("cust-drv", 0.001);
        UUID orderId = releasedFoodOrder("cust-drv");
        CustomerOrder order = order(orderId);
        suggestionRepository.save(DriverSuggestion.builder()
                .customerOrder(order)
                .driverId("cust-drv")
                .cycle(1)
                .distanceKm(new BigDecimal("0.111"))
                .status(SuggestionStatus.SENT)
                .notifiedAt(T0)
                .expiresAt(T0.plusSeconds(60))
                .build());

        assertThatThrownBy(() -> responseService.acceptOrder(orderId, "cust-drv"))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getError())
                .isEqualTo(DispatchError.SELF_ASSIGNMENT_FORBIDDEN);
        assertThat(order(orderId).getAssignedDriverId()).isNull();
    }

    @Test
    @DisplayName("The customer's own driver profile never enters the candidate pool")
    void customerIsNeverOfferedOwnOrder() {
        saveDriver("cust-drv", 0.001);
        saveDriver("drv-x", 0.002);
        UUID orderId = releasedFoodOrder("cust-drv");

        matchLoop.runOnce();

        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId))
                .extracting(DriverSuggestion::getDriverId)
                .containsExactly("drv-x");
    }

    @Test
    @DisplayName("Accepting after the window closed is forbidden")
    void acceptAfterExpiryIsForbidden() {
        foodDrivers(2);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        now = T0.plusSeconds(60);

        assertThatThrownBy(() -> responseService.acceptOrder(orderId, "drv-1"))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getError())
                .isEqualTo(DispatchError.NO_LIVE_OFFER);
    }

    @Test
    @DisplayName("Suggested orders list shows live offers only, and only to approved drivers")
    void suggestedOrdersListsLiveOffers() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        List<SuggestedOrderResponse> forNearest = responseService.listSuggestedOrders("drv-1");
        assertThat(forNearest).singleElement().satisfies(s -> {
            assertThat(s.getOrderId()).isEqualTo(orderId);
            assertThat(s.getExpiresAt()).isEqualTo(T0.plusSeconds(60));
            assertThat(s.getDistanceToPickupKm()).isEqualByComparingTo("0.111");
        });
        assertThat(responseService.listSuggestedOrders("drv-3")).isEmpty();
        assertThat(responseService.listSuggestedOrders("nobody")).isEmpty();

        now = T0.plusSeconds(60);
        assertThat(responseService.listSuggestedOrders("drv-1")).isEmpty();
    }

    @Test
    @DisplayName("Cancelling while offers are out voids them and stops dispatching")
    void cancelVoidsOutstandingOffers() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        matchLoop.runOnce();

        intakeService.cancelOrder(orderId, "cust-1");

        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId))
                .extracting(DriverSuggestion::getStatus)
                .containsOnly(SuggestionStatus.EXPIRED);
        assertThat(state(orderId).isActive()).isFalse();

        advance(Duration.ofSeconds(61));
        assertThat(matchLoop.runOnce()).isEmpty();
        assertThatThrownBy(() -> responseService.acceptOrder(orderId, "drv-1"))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getError())
                .isEqualTo(DispatchError.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("Kill switch pauses the loop")
    void killSwitchPausesLoop() {
        foodDrivers(3);
        UUID orderId = releasedFoodOrder("cust-1");
        given(featureFlagService.isEnabled(eq(FeatureFlagService.DISPATCH_KILL_SWITCH), anyBoolean()))
                .willReturn(true);

        assertThat(matchLoop.runOnce()).isEmpty();
        assertThat(stateRepository.findById(orderId)).isEmpty();
        assertThat(order(orderId).getStatus()).isEqualTo(OrderStatus.SEARCHING_FOR_DRIVER);
    }

    // ── helpers ──────────────────────────────────────────────────────────

    /** drv-1 .. drv-n, each ~111 m further north of the pickup than the previous one. */
    private void foodDrivers(int count) {
        for (int i = 1; i <= count; i++) {
            saveDriver("drv-" + i, 0.001 * i);
        }
    }

    private void saveDriver(String driverId, double latOffset) {
        profileRepository.save(DriverProfile.builder()
                .driverId(driverId)
                .approvalStatus(DriverApprovalStatus.APPROVED)
                .vehicleType(VehicleType.BIKE)
                .acceptsFood(true)
                .online(true)
                .build());
        locationRepository.save(DriverLocation.builder()
                .driverId(driverId)
                .latitude(PICKUP_LAT + latOffset)
                .longitude(PICKUP_LNG)
                .updatedAt(now)
                .build());
    }

    /** Moves the clock forward; drivers keep pinging their location meanwhile. */
    private void advance(Duration duration) {
        now = now.plus(duration);
        List<DriverLocation> locations = locationRepository.findAll();
        locations.forEach(l -> l.setUpdatedAt(now));
        locationRepository.saveAll(locations);
    }

    private UUID releasedFoodOrder(String customerId) {
        CreateOrderRequest req = new CreateOrderRequest();
        req.setCustomerId(customerId);
        req.setServiceType(ServiceType.FOOD);
        req.setPickupLat(PICKUP_LAT);
        req.setPickupLng(PICKUP_LNG);
        req.setDropoffLat(41.3111);
        req.setDropoffLng(69.2797);
        req.setQuotedDistanceKm(new BigDecimal("3.500"));
        req.setQuotedPrice(new BigDecimal("18000.00"));

        UUID orderId = intakeService.createOrder(req, null).getOrderId();
        intakeService.releaseForDispatch(orderId);
        return orderId;
    }

    private CustomerOrder order(UUID orderId) {
        return orderRepository.findById(orderId).orElseThrow();
    }

    private DispatchState state(UUID orderId) {
        return stateRepository.findById(orderId).orElseThrow();
    }

    private DriverSuggestion suggestion(UUID orderId, String driverId) {
        return suggestionRepository.findByCustomerOrderIdOrderByCycleAscDriverIdAsc(orderId).stream()
                .filter(s -> s.getDriverId().equals(driverId))
                .findFirst()
                .orElseThrow();
    }
}
