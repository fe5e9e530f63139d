package com.marketplace.dispatch.model;

import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.VehicleType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Checkout hand-off. Distance and price come precomputed from the pricing service.
 */
@Data
public class CreateOrderRequest {

    @NotBlank
    private String customerId;

    @NotNull
    private ServiceType serviceType;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    private VehicleType requestedVehicleType;

    @NotNull
    @PositiveOrZero
    private BigDecimal quotedDistanceKm;

    @NotNull
    @PositiveOrZero
    private BigDecimal quotedPrice;
}
