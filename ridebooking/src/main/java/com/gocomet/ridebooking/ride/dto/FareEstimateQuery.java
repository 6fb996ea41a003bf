package com.gocomet.ridebooking.ride.dto;

import com.gocomet.ridebooking.fare.model.GeoPoint;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import jakarta.validation.constraints.*;
import lombok.*;

/**
 * Query parameters of GET /v1/rides/estimate.
 */
@Getter
@Setter
@NoArgsConstructor
public class FareEstimateQuery {

    @NotNull(message = "Valid from latitude is required")
    @DecimalMin(value = "-90", message = "Valid from latitude is required")
    @DecimalMax(value = "90", message = "Valid from latitude is required")
    private Double fromLat;

    @NotNull(message = "Valid from longitude is required")
    @DecimalMin(value = "-180", message = "Valid from longitude is required")
    @DecimalMax(value = "180", message = "Valid from longitude is required")
    private Double fromLng;

    @NotNull(message = "Valid to latitude is required")
    @DecimalMin(value = "-90", message = "Valid to latitude is required")
    @DecimalMax(value = "90", message = "Valid to latitude is required")
    private Double toLat;

    @NotNull(message = "Valid to longitude is required")
    @DecimalMin(value = "-180", message = "Valid to longitude is required")
    @DecimalMax(value = "180", message = "Valid to longitude is required")
    private Double toLng;

    @NotBlank(message = "From address is required")
    private String fromAddress;

    @NotBlank(message = "To address is required")
    private String toAddress;

    private RideCategory rideType = RideCategory.ECONOMY;

    public Location pickup() {
        return new Location(fromAddress.trim(), new GeoPoint(fromLat, fromLng));
    }

    public Location drop() {
        return new Location(toAddress.trim(), new GeoPoint(toLat, toLng));
    }
}
