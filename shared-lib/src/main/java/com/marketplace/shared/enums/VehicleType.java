package com.marketplace.shared.enums;

public enum VehicleType {
    BIKE,
    MOTOR,
    CAR,
    VAN
}
