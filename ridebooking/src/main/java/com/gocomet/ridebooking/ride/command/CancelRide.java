package com.gocomet.ridebooking.ride.command;

import lombok.Value;

import java.util.UUID;

@Value
public class CancelRide implements RideCommand {

    public static final String DEFAULT_REASON = "Cancelled by user";

    UUID riderId;
    String reason;

    @Override
    public String verb() {
        return "cancel";
    }
}
