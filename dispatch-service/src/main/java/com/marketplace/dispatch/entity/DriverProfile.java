package com.marketplace.dispatch.entity;

import com.marketplace.shared.enums.DriverApprovalStatus;
import com.marketplace.shared.enums.VehicleType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Read model of the driver profile owned by the onboarding service. Only the
 * online flag is written here.
 */
@Entity
@Table(name = "driver_profiles",
        indexes = @Index(name = "idx_driver_approval_online", columnList = "approval_status, is_online"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "driverId")
public class DriverProfile {

    @Id
    @Column(name = "driver_id")
    private String driverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false)
    private DriverApprovalStatus approvalStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_type")
    private VehicleType vehicleType;

    @Column(name = "accepts_food", nullable = false)
    private boolean acceptsFood;

    @Column(name = "accepts_parcel", nullable = false)
    private boolean acceptsParcel;

    @Column(name = "accepts_ride", nullable = false)
    private boolean acceptsRide;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isApproved() {
        return approvalStatus == DriverApprovalStatus.APPROVED;
    }
}
