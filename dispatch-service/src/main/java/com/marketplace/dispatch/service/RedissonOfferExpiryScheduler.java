package com.marketplace.dispatch.service;

import com.marketplace.dispatch.config.DispatchProperties;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.dispatch.model.OfferCycleKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBlockingQueue;
import org.redisson.api.RDelayedQueue;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Expiry timers on a Redisson delayed queue, so they survive restarts and are
 * shared by every instance.
 *
 * Timers are {@code orderId:cycle} strings. Redisson moves them to the ready
 * queue when due; {@link #drainDueTimers()} polls that queue and runs the expiry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedissonOfferExpiryScheduler implements OfferExpiryScheduler {

    static final String READY_QUEUE = "dispatch:offer-expiry";
    private static final int MAX_TIMERS_PER_DRAIN = 500;

    private final RedissonClient redissonClient;
    private final OfferExpiryService expiryService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    private RBlockingQueue<String> readyQueue;
    private RDelayedQueue<String> delayedQueue;

    @Override
    public void schedule(OfferCycleKey key, Duration delay) {
        long delayMs = Math.max(0L, delay.toMillis());
        delayedQueue().offer(key.encode(), delayMs, TimeUnit.MILLISECONDS);
        log.debug("Armed expiry timer for order {} cycle {} in {}ms", key.orderId(), key.cycle(), delayMs);
    }

    @Scheduled(fixedDelayString = "${dispatch.expiry-poll-ms:1000}")
    public int drainDueTimers() {
        // the delayed queue must exist for Redisson to transfer due entries
        delayedQueue();

        int handled = 0;
        String item;
        while (handled < MAX_TIMERS_PER_DRAIN && (item = readyQueue.poll()) != null) {
            handled++;
            fire(item);
        }
        return handled;
    }

    void fire(String item) {
        OfferCycleKey key;
        try {
            key = OfferCycleKey.parse(item);
        } catch (IllegalArgumentException e) {
            log.error("Dropping malformed expiry timer '{}'", item, e);
            return;
        }

        try {
            expiryService.expire(key.orderId(), key.cycle());
        } catch (PessimisticLockingFailureException e) {
            metrics.recordLockTimeout();
            log.info("Order {} busy while expiring cycle {}, re-arming timer", key.orderId(), key.cycle());
            schedule(key, properties.retryDelay());
        } catch (RuntimeException e) {
            log.error("Expiry of order {} cycle {} failed, leaving it to the sweeper",
                    key.orderId(), key.cycle(), e);
        }
    }

    private synchronized RDelayedQueue<String> delayedQueue() {
        if (delayedQueue == null) {
            readyQueue = redissonClient.getBlockingQueue(READY_QUEUE, StringCodec.INSTANCE);
            delayedQueue = redissonClient.getDelayedQueue(readyQueue);
        }
        return delayedQueue;
    }
}
