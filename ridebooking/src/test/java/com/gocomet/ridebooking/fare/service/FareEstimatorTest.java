package com.gocomet.ridebooking.fare.service;

import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.fare.model.GeoPoint;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Formula: adjusted = max(50 + distKm * 15 * multiplier, 80); gst = adjusted * 0.18; total = adjusted + gst
 */
class FareEstimatorTest {

    private static final GeoPoint BANDRA = new GeoPoint(19.0760, 72.8777);
    private static final GeoPoint KHAR = new GeoPoint(19.0896, 72.8656);

    private FareEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new FareEstimator(new BigDecimal("15"));
    }

    @Test
    @DisplayName("Haversine distance between two nearby Mumbai points is 1.98 km")
    void distance_knownPair() {
        assertThat(estimator.distanceKm(BANDRA, KHAR)).isEqualTo(1.98);
    }

    @Test
    @DisplayName("Distance is symmetric and zero for identical points")
    void distance_symmetricAndZero() {
        GeoPoint bangalore = new GeoPoint(12.9716, 77.5946);
        GeoPoint koramangala = new GeoPoint(12.9352, 77.6245);

        assertThat(estimator.distanceKm(bangalore, koramangala))
                .isEqualTo(estimator.distanceKm(koramangala, bangalore))
                .isEqualTo(5.18);
        assertThat(estimator.distanceKm(BANDRA, BANDRA)).isZero();
    }

    @Test
    @DisplayName("2.37 km economy: 85.55 + 15.40 GST = 100.95, 5 minutes")
    void quote_economyAboveMinimum() {
        FareQuote quote = estimator.quote(2.37, RideCategory.ECONOMY);

        assertThat(quote.getBaseFare()).isEqualByComparingTo("85.55");
        assertThat(quote.getGst()).isEqualByComparingTo("15.40");
        assertThat(quote.getTotalFare()).isEqualByComparingTo("100.95");
        assertThat(quote.getEstimatedMinutes()).isEqualTo(5);
        assertThat(quote.getFarePerKm()).isEqualByComparingTo("15");
        assertThat(quote.getRideCategory()).isEqualTo(RideCategory.ECONOMY);
    }

    @Test
    @DisplayName("Short economy ride is lifted to the 80 minimum before GST")
    void quote_minimumFareApplied() {
        FareQuote quote = estimator.quote(
                new Location("Bandra", BANDRA), new Location("Khar", KHAR), RideCategory.ECONOMY);

        // 50 + 1.98 * 15 = 79.70 -> 80
        assertThat(quote.getDistanceKm()).isEqualTo(1.98);
        assertThat(quote.getBaseFare()).isEqualByComparingTo("80.00");
        assertThat(quote.getGst()).isEqualByComparingTo("14.40");
        assertThat(quote.getTotalFare()).isEqualByComparingTo("94.40");
        assertThat(quote.getEstimatedMinutes()).isEqualTo(4);
        assertThat(quote.getPickupAddress()).isEqualTo("Bandra");
        assertThat(quote.getDropAddress()).isEqualTo("Khar");
    }

    @Test
    @DisplayName("Independent rounding: 2.37 km premium gives 103.33 + 18.60 but total 121.92")
    void quote_independentRoundingIsPreserved() {
        // adjusted = 103.325, gst = 18.5985, total = 121.9235
        FareQuote quote = estimator.quote(2.37, RideCategory.PREMIUM);

        assertThat(quote.getBaseFare()).isEqualByComparingTo("103.33");
        assertThat(quote.getGst()).isEqualByComparingTo("18.60");
        assertThat(quote.getTotalFare()).isEqualByComparingTo("121.92");
        assertThat(quote.getBaseFare().add(quote.getGst())).isEqualByComparingTo("121.93");
    }

    @ParameterizedTest
    @EnumSource(RideCategory.class)
    @DisplayName("Adjusted fare never drops below 80 and total stays within 0.01 of adjusted + GST")
    void quote_invariantsHoldAcrossDistances(RideCategory category) {
        for (int i = 0; i <= 400; i++) {
            FareQuote quote = estimator.quote(i * 0.13, category);

            assertThat(quote.getBaseFare()).isGreaterThanOrEqualTo(new BigDecimal("80"));
            assertThat(quote.getTotalFare().doubleValue())
                    .isCloseTo(quote.getBaseFare().add(quote.getGst()).doubleValue(), within(0.0100001));
            assertThat(quote.getBaseFare().scale()).isEqualTo(2);
            assertThat(quote.getTotalFare().scale()).isEqualTo(2);
        }
    }

    @ParameterizedTest
    @EnumSource(RideCategory.class)
    @DisplayName("Total fare is non-decreasing in distance")
    void quote_monotonicInDistance(RideCategory category) {
        BigDecimal previous = BigDecimal.ZERO;
        for (int i = 0; i <= 200; i++) {
            BigDecimal total = estimator.quote(i * 0.25, category).getTotalFare();
            assertThat(total).isGreaterThanOrEqualTo(previous);
            previous = total;
        }
    }

    @Test
    @DisplayName("Luxury ≥ premium ≥ economy for the same distance")
    void quote_categoryOrdering() {
        FareQuote economy = estimator.quote(10.0, RideCategory.ECONOMY);
        FareQuote premium = estimator.quote(10.0, RideCategory.PREMIUM);
        FareQuote luxury = estimator.quote(10.0, RideCategory.LUXURY);

        assertThat(economy.getTotalFare()).isEqualByComparingTo("236.00");
        assertThat(premium.getTotalFare()).isEqualByComparingTo("324.50");
        assertThat(luxury.getTotalFare()).isEqualByComparingTo("413.00");
    }

    @Test
    @DisplayName("Zero distance costs the minimum fare and zero minutes")
    void quote_zeroDistance() {
        FareQuote quote = estimator.quote(0.0, RideCategory.LUXURY);

        assertThat(quote.getBaseFare()).isEqualByComparingTo("80.00");
        assertThat(quote.getTotalFare()).isEqualByComparingTo("94.40");
        assertThat(quote.getEstimatedMinutes()).isZero();
    }

    @Test
    @DisplayName("Duration is an exact ceiling of distance at 30 km/h")
    void quote_estimatedMinutesRoundsUp() {
        assertThat(estimator.quote(1.5, RideCategory.ECONOMY).getEstimatedMinutes()).isEqualTo(3);
        assertThat(estimator.quote(1.51, RideCategory.ECONOMY).getEstimatedMinutes()).isEqualTo(4);
        assertThat(estimator.quote(15.0, RideCategory.ECONOMY).getEstimatedMinutes()).isEqualTo(30);
    }

    @Test
    @DisplayName("Injected per-km rate replaces the default of 15")
    void quote_customRate() {
        FareEstimator pricier = new FareEstimator(new BigDecimal("20"));

        FareQuote quote = pricier.quote(10.0, RideCategory.ECONOMY);

        assertThat(quote.getBaseFare()).isEqualByComparingTo("250.00");
        assertThat(quote.getFarePerKm()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("Negative per-km rate is rejected")
    void constructor_rejectsNegativeRate() {
        assertThatThrownBy(() -> new FareEstimator(new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
