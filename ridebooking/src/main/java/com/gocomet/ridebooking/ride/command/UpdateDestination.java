package com.gocomet.ridebooking.ride.command;

import com.gocomet.ridebooking.fare.model.Location;
import lombok.Value;

import java.util.UUID;

@Value
public class UpdateDestination implements RideCommand {
    UUID riderId;
    Location newDrop;

    @Override
    public String verb() {
        return "update destination of";
    }
}
