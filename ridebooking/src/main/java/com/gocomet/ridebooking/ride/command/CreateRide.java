package com.gocomet.ridebooking.ride.command;

import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.ride.model.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CreateRide {
    UUID riderId;
    Location pickup;
    Location drop;
    RideCategory category;
    PaymentMethod paymentMethod;
    String notes;
}
