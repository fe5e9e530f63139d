package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.repository.CustomerOrderRepository;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryProgressServiceTest {

    @Mock private CustomerOrderRepository orderRepository;
    @Mock private OrderStatusRecorder statusRecorder;
    @Mock private DispatchEventPublisher eventPublisher;

    @InjectMocks
    private DeliveryProgressService service;

    private UUID orderId;
    private CustomerOrder order;

    @BeforeEach
    void setUp() {
        orderId = UUID.randomUUID();
        order = CustomerOrder.builder()
                .id(orderId)
                .customerId("cust-1")
                .serviceType(ServiceType.PARCEL)
                .assignedDriverId("drv-1")
                .build();
    }

    @ParameterizedTest
    @CsvSource({"ACCEPTED,ON_THE_WAY", "ON_THE_WAY,DELIVERED", "DELIVERED,COMPLETED"})
    @DisplayName("Assigned driver moves the order one step forward")
    void advancesOneStep(OrderStatus from, OrderStatus to) {
        order.setStatus(from);
        when(orderRepository.lockById(orderId)).thenReturn(Optional.of(order));

        service.advance(orderId, "drv-1", to);

        verify(statusRecorder).transition(order, to);
        verify(eventPublisher).publish(KafkaTopics.ORDER_STATUS_CHANGED, order, null, 0);
    }

    @Test
    @DisplayName("Skipping a step is INVALID_STATUS_TRANSITION")
    void rejectsSkippedStep() {
        order.setStatus(OrderStatus.ACCEPTED);
        when(orderRepository.lockById(orderId)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> service.advance(orderId, "drv-1", OrderStatus.COMPLETED))
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("ACCEPTED");
        verifyNoInteractions(statusRecorder, eventPublisher);
    }

    @Test
    @DisplayName("Another driver's order is ORDER_NOT_FOUND")
    void rejectsForeignDriver() {
        order.setStatus(OrderStatus.ACCEPTED);
        when(orderRepository.lockById(orderId)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> service.advance(orderId, "drv-2", OrderStatus.ON_THE_WAY))
                .isInstanceOf(DispatchException.class)
                .matches(e -> ((DispatchException) e).getError() == DispatchError.ORDER_NOT_FOUND);
    }
}
