package com.marketplace.shared.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Great-circle distance helpers. Offers are always local-scale, so the plain
 * haversine formula is used without antipodal special-casing.
 */
public final class GeoUtil {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final int DISTANCE_SCALE = 3;

    private GeoUtil() {}

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Distance rounded to metres (3 decimals, HALF_UP) for storage and display.
     */
    public static BigDecimal roundedDistanceKm(double lat1, double lng1, double lat2, double lng2) {
        return BigDecimal.valueOf(distanceKm(lat1, lng1, lat2, lng2))
                .setScale(DISTANCE_SCALE, RoundingMode.HALF_UP);
    }
}
