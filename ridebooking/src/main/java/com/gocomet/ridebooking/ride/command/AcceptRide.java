package com.gocomet.ridebooking.ride.command;

import lombok.Value;

import java.util.UUID;

@Value
public class AcceptRide implements RideCommand {
    UUID driverId;

    @Override
    public String verb() {
        return "accept";
    }
}
