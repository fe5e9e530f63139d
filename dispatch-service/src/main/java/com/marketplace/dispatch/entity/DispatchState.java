package com.marketplace.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-order dispatch bookkeeping, one row per order, created on the first loop
 * pass and never deleted. {@code cycle} only grows; {@code active = false}
 * takes the order out of automatic matching for good.
 */
@Entity
@Table(name = "order_dispatch_states")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "orderId")
public class DispatchState {

    @Id
    @Column(name = "order_id")
    private UUID orderId;

    @Column(nullable = false)
    private int cycle;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "last_dispatched_at")
    private Instant lastDispatchedAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public static DispatchState initial(UUID orderId) {
        return DispatchState.builder()
                .orderId(orderId)
                .cycle(0)
                .active(true)
                .build();
    }
}
