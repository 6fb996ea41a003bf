package com.gocomet.ridebooking.ride.dto;

import com.gocomet.ridebooking.fare.model.GeoPoint;
import com.gocomet.ridebooking.fare.model.Location;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationRequest {

    @NotBlank(message = "Address is required")
    private String address;

    @NotNull(message = "Coordinates are required")
    @Valid
    private CoordinatesRequest coordinates;

    public Location toLocation() {
        return new Location(address.trim(),
                new GeoPoint(coordinates.getLatitude(), coordinates.getLongitude()));
    }
}
