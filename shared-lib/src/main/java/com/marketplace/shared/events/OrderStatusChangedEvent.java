package com.marketplace.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.marketplace.shared.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedEvent {

    private String orderId;
    private String customerId;
    private String driverId;
    private OrderStatus status;
    private String reason;
    private int dispatchCycle;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
