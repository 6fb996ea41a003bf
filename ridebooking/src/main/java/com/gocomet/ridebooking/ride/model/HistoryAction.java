package com.gocomet.ridebooking.ride.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HistoryAction {
    CREATED,
    ACCEPTED,
    STARTED,
    DESTINATION_UPDATED,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
