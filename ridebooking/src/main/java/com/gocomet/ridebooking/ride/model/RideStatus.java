package com.gocomet.ridebooking.ride.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public enum RideStatus {
    PENDING,
    ACCEPTED,
    STARTED,
    COMPLETED,
    CANCELLED;

    /** Statuses that count towards the one-active-ride-per-rider limit. */
    public static final List<RideStatus> ACTIVE = List.of(PENDING, ACCEPTED, STARTED);

    private static final Set<RideStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RideStatus from(String value) {
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid ride status: " + value));
    }
}
