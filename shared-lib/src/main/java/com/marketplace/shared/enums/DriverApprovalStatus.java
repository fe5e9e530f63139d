package com.marketplace.shared.enums;

public enum DriverApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
