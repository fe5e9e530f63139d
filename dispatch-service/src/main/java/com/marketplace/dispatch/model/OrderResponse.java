package com.marketplace.dispatch.model;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID orderId;
    private String customerId;
    private ServiceType serviceType;
    private OrderStatus status;
    private String assignedDriverId;
    private VehicleType requestedVehicleType;
    private BigDecimal quotedDistanceKm;
    private BigDecimal quotedPrice;
    private Instant createdAt;
    private Instant updatedAt;

    public static OrderResponse from(CustomerOrder o) {
        return OrderResponse.builder()
                .orderId(o.getId())
                .customerId(o.getCustomerId())
                .serviceType(o.getServiceType())
                .status(o.getStatus())
                .assignedDriverId(o.getAssignedDriverId())
                .requestedVehicleType(o.getRequestedVehicleType())
                .quotedDistanceKm(o.getQuotedDistanceKm())
                .quotedPrice(o.getQuotedPrice())
                .createdAt(o.getCreatedAt())
                .updatedAt(o.getUpdatedAt())
                .build();
    }
}
