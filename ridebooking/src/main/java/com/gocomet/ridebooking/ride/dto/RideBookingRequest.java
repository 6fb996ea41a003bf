package com.gocomet.ridebooking.ride.dto;

import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.ride.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideBookingRequest {

    @NotNull(message = "Pickup location is required")
    @Valid
    private LocationRequest pickupLocation;

    @NotNull(message = "Drop location is required")
    @Valid
    private LocationRequest dropLocation;

    // Defaults to economy when absent
    private RideCategory rideType;

    private PaymentMethod paymentMethod;

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    private String notes;
}
