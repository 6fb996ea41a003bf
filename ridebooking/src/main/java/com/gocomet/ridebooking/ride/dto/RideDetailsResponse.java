package com.gocomet.ridebooking.ride.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gocomet.ridebooking.fare.model.FareQuote;
import lombok.*;

/**
 * Body of ride endpoints: the ride, plus the fare breakdown when one was just computed.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RideDetailsResponse {

    private RideResponse ride;
    private FareQuote fareBreakdown;

    public static RideDetailsResponse of(RideResponse ride) {
        return new RideDetailsResponse(ride, null);
    }
}
