package com.gocomet.ridebooking.fare.service;

import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.fare.model.GeoPoint;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Distance and fare calculation. Pure: no I/O, no shared state.
 *
 * Formula:
 *   adjusted = max(BASE_FARE + distanceKm * farePerKm * multiplier, MINIMUM_FARE)
 *   gst      = adjusted * GST_RATE
 *   total    = adjusted + gst
 *
 * Coordinates are expected to be range-checked by the caller.
 */
public class FareEstimator {

    private static final double EARTH_RADIUS_KM = 6371;
    private static final BigDecimal BASE_FARE = new BigDecimal("50");
    private static final BigDecimal MINIMUM_FARE = new BigDecimal("80");
    private static final BigDecimal GST_RATE = new BigDecimal("0.18");
    private static final BigDecimal AVERAGE_SPEED_KMPH = new BigDecimal("30");
    private static final BigDecimal MINUTES_PER_HOUR = new BigDecimal("60");

    private final BigDecimal farePerKm;

    public FareEstimator(BigDecimal farePerKm) {
        if (farePerKm == null || farePerKm.signum() < 0) {
            throw new IllegalArgumentException("farePerKm must be non-negative");
        }
        this.farePerKm = farePerKm;
    }

    /**
     * Great-circle distance using the haversine formula, rounded to 2 decimal places.
     */
    public double distanceKm(GeoPoint from, GeoPoint to) {
        double dLat = Math.toRadians(to.getLatitude() - from.getLatitude());
        double dLng = Math.toRadians(to.getLongitude() - from.getLongitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(from.getLatitude())) * Math.cos(Math.toRadians(to.getLatitude()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return BigDecimal.valueOf(EARTH_RADIUS_KM * c).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public FareQuote quote(Location pickup, Location drop, RideCategory category) {
        double distance = distanceKm(pickup.getCoordinates(), drop.getCoordinates());
        return quote(distance, category).toBuilder()
                .pickupAddress(pickup.getAddress())
                .dropAddress(drop.getAddress())
                .build();
    }

    /**
     * Fare breakdown for an already-known distance.
     */
    public FareQuote quote(double distanceKm, RideCategory category) {
        BigDecimal distance = BigDecimal.valueOf(distanceKm);

        BigDecimal fare = BASE_FARE.add(distance.multiply(farePerKm).multiply(category.getMultiplier()));
        BigDecimal adjusted = fare.max(MINIMUM_FARE);
        BigDecimal gst = adjusted.multiply(GST_RATE);
        BigDecimal total = adjusted.add(gst);

        return FareQuote.builder()
                .baseFare(adjusted.setScale(2, RoundingMode.HALF_UP))
                .gst(gst.setScale(2, RoundingMode.HALF_UP))
                .totalFare(total.setScale(2, RoundingMode.HALF_UP))
                .distanceKm(distanceKm)
                .farePerKm(farePerKm)
                .rideCategory(category)
                .estimatedMinutes(estimatedMinutes(distance))
                .build();
    }

    // distance / 30 km/h, in whole minutes rounded up
    private int estimatedMinutes(BigDecimal distanceKm) {
        return distanceKm.multiply(MINUTES_PER_HOUR)
                .divide(AVERAGE_SPEED_KMPH, 0, RoundingMode.CEILING)
                .intValueExact();
    }
}
