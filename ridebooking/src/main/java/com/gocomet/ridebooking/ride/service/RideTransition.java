package com.gocomet.ridebooking.ride.service;

import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.ride.model.HistoryEntry;
import com.gocomet.ridebooking.ride.model.Ride;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one successful lifecycle step: the ride after the change, the single
 * history entry that was appended, and the quote when the fare was recomputed.
 */
@Getter
@AllArgsConstructor
public class RideTransition {

    private final Ride ride;
    private final HistoryEntry entry;
    private final FareQuote quote;
}
