package com.marketplace.dispatch.model;

import java.util.UUID;

/**
 * Identifies the offers of one dispatch cycle. Serialised as {@code orderId:cycle}
 * on the expiry timer queue.
 */
public record OfferCycleKey(UUID orderId, int cycle) {

    public String encode() {
        return orderId + ":" + cycle;
    }

    public static OfferCycleKey parse(String value) {
        int sep = value.lastIndexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new IllegalArgumentException("Malformed offer cycle key: " + value);
        }
        return new OfferCycleKey(
                UUID.fromString(value.substring(0, sep)),
                Integer.parseInt(value.substring(sep + 1)));
    }
}
