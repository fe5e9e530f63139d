package com.marketplace.dispatch.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DriverStatusResponse {
    private String driverId;
    private boolean online;
    private Double latitude;
    private Double longitude;
    private Instant locationUpdatedAt;
}
