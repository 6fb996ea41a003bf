package com.gocomet.ridebooking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RideBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RideBookingApplication.class, args);
    }
}
