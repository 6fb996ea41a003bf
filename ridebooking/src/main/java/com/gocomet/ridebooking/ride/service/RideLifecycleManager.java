package com.gocomet.ridebooking.ride.service;

import com.gocomet.ridebooking.common.exception.RideNotModifiableException;
import com.gocomet.ridebooking.fare.config.FareProperties;
import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.fare.service.FareEstimator;
import com.gocomet.ridebooking.ride.command.*;
import com.gocomet.ridebooking.ride.model.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Ride state machine.
 *
 * PENDING → ACCEPTED → STARTED → COMPLETED
 * PENDING | ACCEPTED → CANCELLED
 * ACCEPTED | STARTED → (destination updated, status unchanged)
 *
 * Every guard is checked before the first field is touched, so a rejected
 * command leaves the ride and its history exactly as they were. Each accepted
 * command appends exactly one history entry.
 *
 * Does no I/O. Checking that the rider has no other active ride is the
 * caller's job.
 */
@Component
@RequiredArgsConstructor
public class RideLifecycleManager {

    private static final Set<RideStatus> CANCELLABLE = EnumSet.of(RideStatus.PENDING, RideStatus.ACCEPTED);
    private static final Set<RideStatus> DESTINATION_EDITABLE = EnumSet.of(RideStatus.ACCEPTED, RideStatus.STARTED);

    private final FareEstimator fareEstimator;
    private final FareProperties fareProperties;
    private final Clock clock;

    public RideTransition create(CreateRide command) {
        FareQuote quote = fareEstimator.quote(command.getPickup(), command.getDrop(), command.getCategory());
        LocalDateTime now = LocalDateTime.now(clock);

        Ride ride = Ride.builder()
                .id(UUID.randomUUID())
                .riderId(command.getRiderId())
                .status(RideStatus.PENDING)
                .rideCategory(command.getCategory())
                .pickupLocation(command.getPickup())
                .dropLocation(command.getDrop())
                .originalDropLocation(command.getDrop())
                .paymentMethod(command.getPaymentMethod() != null ? command.getPaymentMethod() : PaymentMethod.CASH)
                .notes(command.getNotes())
                .createdAt(now)
                .build();
        applyQuote(ride, quote);

        HistoryEntry entry = new HistoryEntry(HistoryAction.CREATED, now, "Ride request created");
        ride.appendHistory(entry);
        return new RideTransition(ride, entry, quote);
    }

    public RideTransition apply(Ride ride, RideCommand command) {
        if (command instanceof CancelRide cancel) {
            return cancel(ride, cancel);
        }
        if (command instanceof UpdateDestination update) {
            return updateDestination(ride, update);
        }
        if (command instanceof AcceptRide accept) {
            return accept(ride, accept);
        }
        if (command instanceof StartRide start) {
            return start(ride, start);
        }
        if (command instanceof CompleteRide complete) {
            return complete(ride, complete);
        }
        throw new IllegalArgumentException("Unsupported ride command: " + command.getClass().getSimpleName());
    }

    private RideTransition cancel(Ride ride, CancelRide command) {
        requireOwner(ride, command.getRiderId(), command);
        requireStatus(ride, CANCELLABLE, command);

        String reason = command.getReason() != null && !command.getReason().isBlank()
                ? command.getReason()
                : CancelRide.DEFAULT_REASON;

        ride.setStatus(RideStatus.CANCELLED);
        ride.setCancellationReason(reason);
        ride.setCancelledBy(CancelledBy.USER);
        return record(ride, HistoryAction.CANCELLED, reason, null);
    }

    private RideTransition updateDestination(Ride ride, UpdateDestination command) {
        requireOwner(ride, command.getRiderId(), command);
        requireStatus(ride, DESTINATION_EDITABLE, command);

        FareQuote quote = fareEstimator.quote(ride.getPickupLocation(), command.getNewDrop(), ride.getRideCategory());

        ride.setDropLocation(command.getNewDrop());
        applyQuote(ride, quote);
        return record(ride, HistoryAction.DESTINATION_UPDATED,
                "Destination updated to " + command.getNewDrop().getAddress(), quote);
    }

    private RideTransition accept(Ride ride, AcceptRide command) {
        requireStatus(ride, EnumSet.of(RideStatus.PENDING), command);
        if (command.getDriverId() == null) {
            throw new RideNotModifiableException("A driver is required to accept ride " + ride.getId());
        }

        ride.setDriverId(command.getDriverId());
        ride.setStatus(RideStatus.ACCEPTED);
        return record(ride, HistoryAction.ACCEPTED, statusChanged(RideStatus.ACCEPTED), null);
    }

    private RideTransition start(Ride ride, StartRide command) {
        requireStatus(ride, EnumSet.of(RideStatus.ACCEPTED), command);
        requireAssignedDriver(ride, command.getDriverId(), command);

        ride.setStatus(RideStatus.STARTED);
        ride.setRideStartTime(LocalDateTime.now(clock));
        return record(ride, HistoryAction.STARTED, statusChanged(RideStatus.STARTED), null);
    }

    private RideTransition complete(Ride ride, CompleteRide command) {
        requireStatus(ride, EnumSet.of(RideStatus.STARTED), command);
        requireAssignedDriver(ride, command.getDriverId(), command);

        ride.setStatus(RideStatus.COMPLETED);
        ride.setRideEndTime(LocalDateTime.now(clock));
        return record(ride, HistoryAction.COMPLETED, statusChanged(RideStatus.COMPLETED), null);
    }

    private RideTransition record(Ride ride, HistoryAction action, String details, FareQuote quote) {
        HistoryEntry entry = new HistoryEntry(action, LocalDateTime.now(clock), details);
        ride.appendHistory(entry);
        return new RideTransition(ride, entry, quote);
    }

    private void applyQuote(Ride ride, FareQuote quote) {
        ride.setDistanceKm(quote.getDistanceKm());
        ride.setEstimatedMinutes(quote.getEstimatedMinutes());
        ride.setFare(new Fare(quote.getBaseFare(), quote.getTotalFare(), fareProperties.getCurrency()));
    }

    private static void requireStatus(Ride ride, Set<RideStatus> allowed, RideCommand command) {
        if (!allowed.contains(ride.getStatus())) {
            throw new RideNotModifiableException(ride.getId(), ride.getStatus(), command.verb());
        }
    }

    private static void requireOwner(Ride ride, UUID riderId, RideCommand command) {
        if (!Objects.equals(ride.getRiderId(), riderId)) {
            throw new RideNotModifiableException(
                    String.format("Rider %s may not %s ride %s", riderId, command.verb(), ride.getId()));
        }
    }

    private static void requireAssignedDriver(Ride ride, UUID driverId, RideCommand command) {
        if (driverId == null || !driverId.equals(ride.getDriverId())) {
            throw new RideNotModifiableException(
                    String.format("Driver %s is not assigned to ride %s and may not %s it",
                            driverId, ride.getId(), command.verb()));
        }
    }

    private static String statusChanged(RideStatus status) {
        return "Ride status changed to " + status.getValue();
    }
}
