package com.marketplace.dispatch.entity;

import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.VehicleType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A food, parcel or ride order as seen by the dispatcher. Distance and price
 * are quoted upstream at checkout and only carried here.
 */
@Entity
@Table(name = "orders",
        indexes = {
                @Index(name = "idx_order_customer", columnList = "customer_id"),
                @Index(name = "idx_order_status", columnList = "status"),
                @Index(name = "idx_order_driver", columnList = "assigned_driver_id"),
                @Index(name = "idx_order_idempotency", columnList = "idempotency_key", unique = true)
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class CustomerOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false)
    private ServiceType serviceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OrderStatus status;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "assigned_driver_id")
    private String assignedDriverId;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "dropoff_lat", nullable = false)
    private double dropoffLat;

    @Column(name = "dropoff_lng", nullable = false)
    private double dropoffLng;

    @Enumerated(EnumType.STRING)
    @Column(name = "requested_vehicle_type")
    private VehicleType requestedVehicleType;

    @Column(name = "quoted_distance_km", precision = 10, scale = 3)
    private BigDecimal quotedDistanceKm;

    @Column(name = "quoted_price", precision = 12, scale = 2)
    private BigDecimal quotedPrice;

    @Column(name = "idempotency_key", unique = true)
    private String idempotencyKey;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isAssigned() {
        return assignedDriverId != null;
    }
}
