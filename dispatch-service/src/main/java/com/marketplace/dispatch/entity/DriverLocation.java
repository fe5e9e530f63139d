package com.marketplace.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Last reported position of a driver. {@code updatedAt} is stamped by the
 * service clock on every report and drives the staleness filter.
 */
@Entity
@Table(name = "driver_locations",
        indexes = @Index(name = "idx_driver_location_updated", columnList = "updated_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "driverId")
public class DriverLocation {

    @Id
    @Column(name = "driver_id")
    private String driverId;

    @Column(nullable = false)
    private double latitude;

    @Column(nullable = false)
    private double longitude;

    private Integer heading;

    private Double speed;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
