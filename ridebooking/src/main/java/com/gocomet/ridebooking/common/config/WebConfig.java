package com.gocomet.ridebooking.common.config;

import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.ride.model.RideStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Case-insensitive binding of enum query parameters such as {@code rideType=premium}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, RideCategory.class, RideCategory::from);
        registry.addConverter(String.class, RideStatus.class, RideStatus::from);
    }
}
