package com.gocomet.ridebooking.common.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ActiveRideConflictException extends RuntimeException {

    private final UUID activeRideId;

    public ActiveRideConflictException(UUID activeRideId) {
        super("You already have an active ride. Please complete or cancel it first.");
        this.activeRideId = activeRideId;
    }
}
