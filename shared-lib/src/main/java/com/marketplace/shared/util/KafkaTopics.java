package com.marketplace.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String DRIVER_OFFER_SENT         = "driver.offer.sent";
    public static final String ORDER_ACCEPTED            = "order.accepted";
    public static final String ORDER_CANCELLED           = "order.cancelled";
    public static final String ORDER_STATUS_CHANGED      = "order.status_changed";
    public static final String ORDER_DISPATCH_EXHAUSTED  = "order.dispatch_exhausted";
}
