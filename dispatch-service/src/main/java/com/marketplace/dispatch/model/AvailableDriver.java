package com.marketplace.dispatch.model;

import com.marketplace.dispatch.entity.DriverLocation;
import com.marketplace.dispatch.entity.DriverProfile;

/**
 * Row of the candidate pool query: an approved, online driver with a fresh location.
 */
public record AvailableDriver(DriverProfile profile, DriverLocation location) {

    public String driverId() {
        return profile.getDriverId();
    }
}
