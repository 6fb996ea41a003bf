package com.gocomet.ridebooking.fare.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.fare")
public class FareProperties {

    /** Currency units charged per km before the category multiplier. */
    private BigDecimal perKm = new BigDecimal("15");

    private String currency = "INR";
}
