package com.gocomet.ridebooking.ride.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CancelRideRequest {

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    private String reason;
}
