package com.gocomet.ridebooking.ride.command;

import lombok.Value;

import java.util.UUID;

@Value
public class StartRide implements RideCommand {
    UUID driverId;

    @Override
    public String verb() {
        return "start";
    }
}
