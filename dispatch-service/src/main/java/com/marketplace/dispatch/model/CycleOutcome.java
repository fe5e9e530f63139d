package com.marketplace.dispatch.model;

import com.marketplace.dispatch.entity.CustomerOrder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of one loop pass over one order. Side effects that must run after
 * commit (expiry timer, driver push, exhaustion event) are driven from here.
 * {@code order} is the detached snapshot taken under the lock, absent for skips.
 */
public record CycleOutcome(
        Kind kind,
        UUID orderId,
        CustomerOrder order,
        int cycle,
        List<String> offeredDriverIds,
        Instant offeredAt,
        Instant expiresAt) {

    public enum Kind {
        SKIPPED,
        EXHAUSTED,
        NO_CANDIDATES,
        OFFERED
    }

    public static CycleOutcome skipped(UUID orderId) {
        return new CycleOutcome(Kind.SKIPPED, orderId, null, 0, List.of(), null, null);
    }

    public static CycleOutcome exhausted(CustomerOrder order, int cycle) {
        return new CycleOutcome(Kind.EXHAUSTED, order.getId(), order, cycle, List.of(), null, null);
    }

    public static CycleOutcome noCandidates(CustomerOrder order, int cycle) {
        return new CycleOutcome(Kind.NO_CANDIDATES, order.getId(), order, cycle, List.of(), null, null);
    }

    public static CycleOutcome offered(CustomerOrder order, int cycle, List<String> driverIds,
                                       Instant offeredAt, Instant expiresAt) {
        return new CycleOutcome(Kind.OFFERED, order.getId(), order, cycle,
                List.copyOf(driverIds), offeredAt, expiresAt);
    }

    public OfferCycleKey cycleKey() {
        return new OfferCycleKey(orderId, cycle);
    }
}
