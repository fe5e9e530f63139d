package com.marketplace.dispatch.model;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An order currently offered to the calling driver, with the distance snapshot
 * taken when the offer was made.
 */
@Data
@Builder
public class SuggestedOrderResponse {
    private UUID orderId;
    private ServiceType serviceType;
    private OrderStatus status;
    private double pickupLat;
    private double pickupLng;
    private double dropoffLat;
    private double dropoffLng;
    private VehicleType requestedVehicleType;
    private BigDecimal quotedDistanceKm;
    private BigDecimal quotedPrice;
    private BigDecimal distanceToPickupKm;
    private int cycle;
    private Instant expiresAt;
    private Instant createdAt;

    public static SuggestedOrderResponse from(DriverSuggestion s) {
        CustomerOrder o = s.getCustomerOrder();
        return SuggestedOrderResponse.builder()
                .orderId(o.getId())
                .serviceType(o.getServiceType())
                .status(o.getStatus())
                .pickupLat(o.getPickupLat())
                .pickupLng(o.getPickupLng())
                .dropoffLat(o.getDropoffLat())
                .dropoffLng(o.getDropoffLng())
                .requestedVehicleType(o.getRequestedVehicleType())
                .quotedDistanceKm(o.getQuotedDistanceKm())
                .quotedPrice(o.getQuotedPrice())
                .distanceToPickupKm(s.getDistanceKm())
                .cycle(s.getCycle())
                .expiresAt(s.getExpiresAt())
                .createdAt(o.getCreatedAt())
                .build();
    }
}
