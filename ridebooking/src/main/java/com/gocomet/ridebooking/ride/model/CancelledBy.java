package com.gocomet.ridebooking.ride.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CancelledBy {
    USER,
    DRIVER,
    SYSTEM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
