package com.gocomet.ridebooking.ride.dto;

import com.gocomet.ridebooking.ride.model.RideStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
public class RideHistoryQuery {

    @Min(value = 1, message = "Page must be at least 1")
    private int page = 1;

    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 100, message = "Limit cannot exceed 100")
    private int limit = 10;

    private RideStatus status;
}
