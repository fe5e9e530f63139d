package com.marketplace.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.marketplace.shared.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published once per driver when a dispatch cycle offers an order to them.
 * The push gateway consumes it and fans out to the driver's devices.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchOfferSentEvent {

    private String orderId;
    private String driverId;
    private ServiceType serviceType;
    private int cycle;
    private BigDecimal quotedDistanceKm;
    private BigDecimal quotedPrice;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant offeredAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}
