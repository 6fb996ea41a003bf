package com.gocomet.ridebooking.fare.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;

@Getter
public enum RideCategory {
    ECONOMY(new BigDecimal("1.0")),
    PREMIUM(new BigDecimal("1.5")),
    LUXURY(new BigDecimal("2.0"));

    private final BigDecimal multiplier;

    RideCategory(BigDecimal multiplier) {
        this.multiplier = multiplier;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RideCategory from(String value) {
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid ride type: " + value));
    }
}
