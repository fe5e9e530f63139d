package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.DriverLocation;
import com.marketplace.dispatch.entity.DriverProfile;
import com.marketplace.dispatch.exception.DispatchError;
import com.marketplace.dispatch.exception.DispatchException;
import com.marketplace.dispatch.model.DriverStatusResponse;
import com.marketplace.dispatch.model.LocationUpdateRequest;
import com.marketplace.dispatch.repository.DriverLocationRepository;
import com.marketplace.dispatch.repository.DriverProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Online toggle and location reports, the two inputs of the candidate pool.
 * Only approved drivers may use either.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverAvailabilityService {

    private final DriverProfileRepository driverProfileRepository;
    private final DriverLocationRepository driverLocationRepository;
    private final Clock clock;

    @Transactional
    public DriverStatusResponse setOnline(String driverId, boolean online) {
        DriverProfile driver = approvedDriver(driverId);
        driver.setOnline(online);
        log.info("Driver {} is now {}", driverId, online ? "online" : "offline");
        return toResponse(driver, driverLocationRepository.findById(driverId).orElse(null));
    }

    @Transactional
    public DriverStatusResponse updateLocation(String driverId, LocationUpdateRequest req) {
        DriverProfile driver = approvedDriver(driverId);

        DriverLocation location = driverLocationRepository.findById(driverId)
                .orElseGet(() -> DriverLocation.builder().driverId(driverId).build());
        location.setLatitude(req.getLatitude());
        location.setLongitude(req.getLongitude());
        location.setHeading(req.getHeading());
        location.setSpeed(req.getSpeed());
        location.setUpdatedAt(clock.instant());
        location = driverLocationRepository.save(location);

        log.debug("Driver {} at ({},{})", driverId, req.getLatitude(), req.getLongitude());
        return toResponse(driver, location);
    }

    private DriverProfile approvedDriver(String driverId) {
        return driverProfileRepository.findById(driverId)
                .filter(DriverProfile::isApproved)
                .orElseThrow(() -> new DispatchException(DispatchError.DRIVER_NOT_APPROVED,
                        "Driver " + driverId + " is not an approved driver"));
    }

    private DriverStatusResponse toResponse(DriverProfile driver, DriverLocation location) {
        return DriverStatusResponse.builder()
                .driverId(driver.getDriverId())
                .online(driver.isOnline())
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .locationUpdatedAt(location != null ? location.getUpdatedAt() : null)
                .build();
    }
}
