package com.gocomet.ridebooking.fare.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import lombok.*;

/**
 * Address plus coordinates. Value type; rides embed copies of it.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Location {

    @Column(nullable = false)
    private String address;

    @Embedded
    private GeoPoint coordinates;

    public static Location of(String address, double latitude, double longitude) {
        return new Location(address, new GeoPoint(latitude, longitude));
    }
}
