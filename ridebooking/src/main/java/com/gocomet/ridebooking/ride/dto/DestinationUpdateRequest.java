package com.gocomet.ridebooking.ride.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DestinationUpdateRequest {

    @NotNull(message = "New drop location is required")
    @Valid
    private LocationRequest dropLocation;
}
