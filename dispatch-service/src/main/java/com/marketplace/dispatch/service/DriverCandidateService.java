package com.marketplace.dispatch.service;

import com.marketplace.dispatch.config.DispatchProperties;
import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DriverLocation;
import com.marketplace.dispatch.model.AvailableDriver;
import com.marketplace.dispatch.model.DriverCandidate;
import com.marketplace.dispatch.repository.DriverProfileRepository;
import com.marketplace.shared.enums.DriverApprovalStatus;
import com.marketplace.shared.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Finds and ranks nearby driver candidates for an order.
 *
 * Pool: approved, online, location fresher than the staleness window, not the
 * customer, not already offered. Ranking: haversine distance to pickup
 * (rounded to metres), then driver id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverCandidateService {

    private final DriverProfileRepository driverProfileRepository;
    private final DriverEligibilityPolicy eligibilityPolicy;
    private final DispatchProperties properties;
    private final Clock clock;

    public List<DriverCandidate> selectCandidates(CustomerOrder order, Collection<String> excludeDriverIds) {
        Instant freshSince = clock.instant().minus(properties.locationStaleness());

        List<AvailableDriver> pool = driverProfileRepository.findAvailableDrivers(
                DriverApprovalStatus.APPROVED, freshSince, order.getCustomerId());

        List<DriverCandidate> candidates = pool.stream()
                .filter(d -> !excludeDriverIds.contains(d.driverId()))
                .filter(d -> eligibilityPolicy.isEligible(d.profile(), order))
                .map(d -> toCandidate(d, order))
                .sorted(DriverCandidate.BY_DISTANCE)
                .toList();

        log.debug("Found {} candidates (pool {}) for order {} near ({},{})",
                candidates.size(), pool.size(), order.getId(), order.getPickupLat(), order.getPickupLng());
        return candidates;
    }

    private DriverCandidate toCandidate(AvailableDriver driver, CustomerOrder order) {
        DriverLocation loc = driver.location();
        return DriverCandidate.builder()
                .driverId(driver.driverId())
                .distanceKm(GeoUtil.roundedDistanceKm(
                        loc.getLatitude(), loc.getLongitude(),
                        order.getPickupLat(), order.getPickupLng()))
                .build();
    }
}
