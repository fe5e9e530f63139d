package com.marketplace.dispatch.service;

import com.marketplace.dispatch.model.OfferCycleKey;

import java.time.Duration;

/**
 * Arms a one-shot timer that expires the offers of one dispatch cycle.
 * Firing twice or late is harmless: the expiry is a no-op once the cycle moved on.
 */
public interface OfferExpiryScheduler {

    void schedule(OfferCycleKey key, Duration delay);
}
