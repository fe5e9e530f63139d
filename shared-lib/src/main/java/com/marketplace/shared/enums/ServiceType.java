package com.marketplace.shared.enums;

public enum ServiceType {
    FOOD,
    PARCEL,
    RIDE
}
