package com.gocomet.ridebooking.fare.config;

import com.gocomet.ridebooking.fare.service.FareEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FareProperties.class)
@Slf4j
public class FareConfig {

    @Bean
    public FareEstimator fareEstimator(FareProperties properties) {
        log.info("Fare estimator configured with {} {}/km", properties.getPerKm(), properties.getCurrency());
        return new FareEstimator(properties.getPerKm());
    }
}
