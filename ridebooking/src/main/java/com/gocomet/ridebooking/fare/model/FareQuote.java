package com.gocomet.ridebooking.fare.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.math.BigDecimal;

/**
 * Fare breakdown for one pickup/drop pair. Built fresh on every estimate and
 * every destination change.
 *
 * {@code baseFare}, {@code gst} and {@code totalFare} are rounded independently,
 * so {@code baseFare + gst} can differ from {@code totalFare} by 0.01.
 */
@Getter
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FareQuote {

    private final BigDecimal baseFare;
    private final BigDecimal gst;
    private final BigDecimal totalFare;
    private final double distanceKm;
    private final BigDecimal farePerKm;
    private final RideCategory rideCategory;
    private final int estimatedMinutes;
    private final String pickupAddress;
    private final String dropAddress;
}
