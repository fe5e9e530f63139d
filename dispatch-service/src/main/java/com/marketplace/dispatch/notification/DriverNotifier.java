package com.marketplace.dispatch.notification;

import com.marketplace.dispatch.entity.CustomerOrder;

import java.time.Instant;
import java.util.List;

/**
 * Tells drivers that an order has been offered to them. Fire-and-forget:
 * implementations never throw and report how many notifications went out.
 */
public interface DriverNotifier {

    int notifyDrivers(CustomerOrder order, int cycle, List<String> driverIds,
                      Instant offeredAt, Instant expiresAt);
}
