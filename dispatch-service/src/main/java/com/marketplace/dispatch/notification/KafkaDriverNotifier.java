package com.marketplace.dispatch.notification;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.metrics.DispatchMetrics;
import com.marketplace.shared.events.DispatchOfferSentEvent;
import com.marketplace.shared.featureflag.FeatureFlagService;
import com.marketplace.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Publishes one driver.offer.sent event per offered driver; the push gateway
 * turns them into device notifications. Keyed by driver id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaDriverNotifier implements DriverNotifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final FeatureFlagService featureFlagService;
    private final DispatchMetrics metrics;

    @Override
    public int notifyDrivers(CustomerOrder order, int cycle, List<String> driverIds,
                             Instant offeredAt, Instant expiresAt) {
        if (driverIds.isEmpty()) {
            return 0;
        }
        if (!pushEnabled()) {
            log.info("Offer push disabled, {} drivers not notified for order {} cycle {}",
                    driverIds.size(), order.getId(), cycle);
            return 0;
        }

        int sent = 0;
        for (String driverId : driverIds) {
            DispatchOfferSentEvent event = DispatchOfferSentEvent.builder()
                    .orderId(order.getId().toString())
                    .driverId(driverId)
                    .serviceType(order.getServiceType())
                    .cycle(cycle)
                    .quotedDistanceKm(order.getQuotedDistanceKm())
                    .quotedPrice(order.getQuotedPrice())
                    .offeredAt(offeredAt)
                    .expiresAt(expiresAt)
                    .build();
            try {
                kafkaTemplate.send(KafkaTopics.DRIVER_OFFER_SENT, driverId, event)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                metrics.recordNotificationFailure();
                                log.warn("Offer notification to driver {} for order {} failed: {}",
                                        driverId, order.getId(), ex.getMessage());
                            }
                        });
                sent++;
            } catch (RuntimeException e) {
                metrics.recordNotificationFailure();
                log.warn("Could not publish offer for order {} to driver {}", order.getId(), driverId, e);
            }
        }
        log.info("Notified {}/{} drivers for order {} cycle {}", sent, driverIds.size(), order.getId(), cycle);
        return sent;
    }

    private boolean pushEnabled() {
        try {
            return featureFlagService.isEnabled(FeatureFlagService.OFFER_PUSH_ENABLED, true);
        } catch (RuntimeException e) {
            log.warn("Feature flag store unreachable, pushing offers as usual: {}", e.getMessage());
            return true;
        }
    }
}
