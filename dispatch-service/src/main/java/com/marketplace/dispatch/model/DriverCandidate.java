package com.marketplace.dispatch.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Candidate driver evaluated during dispatch matching.
 */
@Data
@Builder
public class DriverCandidate {

    /** Nearest first; equal distances fall back to driver id so ranking is repeatable. */
    public static final Comparator<DriverCandidate> BY_DISTANCE =
            Comparator.comparing(DriverCandidate::getDistanceKm)
                    .thenComparing(DriverCandidate::getDriverId);

    private String driverId;
    private BigDecimal distanceKm;
}
