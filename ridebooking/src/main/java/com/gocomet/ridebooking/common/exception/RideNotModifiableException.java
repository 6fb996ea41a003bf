package com.gocomet.ridebooking.common.exception;

import com.gocomet.ridebooking.ride.model.RideStatus;

import java.util.UUID;

/**
 * The ride exists but its status or ownership disallows the requested command.
 * Surfaced to clients the same way as a missing ride.
 */
public class RideNotModifiableException extends RuntimeException {

    public RideNotModifiableException(String message) {
        super(message);
    }

    public RideNotModifiableException(UUID rideId, RideStatus status, String command) {
        super(String.format("Cannot %s ride %s in status %s", command, rideId, status.getValue()));
    }
}
