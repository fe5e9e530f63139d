package com.marketplace.dispatch.entity;

import com.marketplace.shared.enums.SuggestionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One offer of an order to one driver in one dispatch cycle. Rows are only
 * appended; the single allowed mutation is the move out of SENT.
 */
@Entity
@Table(name = "order_driver_suggestions",
        indexes = {
                @Index(name = "idx_suggestion_order_status", columnList = "order_id, status"),
                @Index(name = "idx_suggestion_driver_status", columnList = "driver_id, status"),
                @Index(name = "idx_suggestion_order_cycle", columnList = "order_id, cycle")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "customerOrder")
public class DriverSuggestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private CustomerOrder customerOrder;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(nullable = false)
    private int cycle;

    @Column(name = "distance_km", nullable = false, precision = 10, scale = 3, updatable = false)
    private BigDecimal distanceKm;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SuggestionStatus status;

    @Column(name = "notified_at", nullable = false)
    private Instant notifiedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    /** SENT and not yet past its acceptance window. */
    public boolean isLive(Instant now) {
        return status == SuggestionStatus.SENT && expiresAt.isAfter(now);
    }

    public void close(SuggestionStatus outcome, Instant now) {
        this.status = outcome;
        this.respondedAt = now;
    }
}
