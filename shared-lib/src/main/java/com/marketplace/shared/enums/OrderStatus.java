package com.marketplace.shared.enums;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PENDING,
    SEARCHING_FOR_DRIVER,
    DRIVER_NOTIFICATION_SENT,
    ACCEPTED,
    ON_THE_WAY,
    DELIVERED,
    COMPLETED,
    REJECTED,
    CANCELLED;

    /** Statuses the dispatch loop scans and drivers can still accept or reject. */
    public static final Set<OrderStatus> DISPATCHABLE =
            EnumSet.of(SEARCHING_FOR_DRIVER, DRIVER_NOTIFICATION_SENT);

    public boolean isDispatchable() {
        return DISPATCHABLE.contains(this);
    }
}
