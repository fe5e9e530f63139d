package com.marketplace.dispatch.service;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.dispatch.entity.DriverProfile;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.VehicleType;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a driver's capabilities fit an order.
 *
 * FOOD   : driver accepts food.
 * PARCEL : driver accepts parcels and, if the order asks for a vehicle type, drives exactly that.
 * RIDE   : driver accepts rides and, if the order asks for a vehicle type, drives exactly that.
 */
@Component
public class DriverEligibilityPolicy {

    public boolean isEligible(DriverProfile driver, CustomerOrder order) {
        ServiceType serviceType = order.getServiceType();
        if (serviceType == null) {
            return false;
        }
        return switch (serviceType) {
            case FOOD -> driver.isAcceptsFood();
            case PARCEL -> driver.isAcceptsParcel()
                    && vehicleMatches(driver.getVehicleType(), order.getRequestedVehicleType());
            case RIDE -> driver.isAcceptsRide()
                    && vehicleMatches(driver.getVehicleType(), order.getRequestedVehicleType());
        };
    }

    /** Service types the driver has opted into. */
    public Set<ServiceType> acceptedServiceTypes(DriverProfile driver) {
        Set<ServiceType> types = EnumSet.noneOf(ServiceType.class);
        if (driver.isAcceptsFood())   types.add(ServiceType.FOOD);
        if (driver.isAcceptsParcel()) types.add(ServiceType.PARCEL);
        if (driver.isAcceptsRide())   types.add(ServiceType.RIDE);
        return types;
    }

    private boolean vehicleMatches(VehicleType driverVehicle, VehicleType requested) {
        return requested == null || requested == driverVehicle;
    }
}
