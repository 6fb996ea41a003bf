package com.gocomet.ridebooking.common.event;

import com.gocomet.ridebooking.ride.model.HistoryEntry;
import com.gocomet.ridebooking.ride.model.Ride;
import com.gocomet.ridebooking.ride.model.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A ride transition as published to the "ride-events" Kafka topic.
 *
 * Keyed by rideId so all events for a single ride land in the same partition
 * and are consumed in the order they were written to the ride's history.
 *
 * Event flow:
 * REQUESTED → DRIVER_ASSIGNED → TRIP_STARTED → TRIP_COMPLETED
 * DESTINATION_UPDATED while assigned or started
 * CANCELLED from REQUESTED or DRIVER_ASSIGNED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEvent {

    private String eventId;
    private UUID rideId;
    private UUID riderId;
    private UUID driverId; // null until a driver accepts
    private EventType eventType;
    private RideStatus status;
    private BigDecimal totalFare;
    private String details; // history entry details: cancellation reason, new destination, ...
    private LocalDateTime timestamp;

    public enum EventType {
        REQUESTED,
        DRIVER_ASSIGNED,
        TRIP_STARTED,
        DESTINATION_UPDATED,
        TRIP_COMPLETED,
        CANCELLED
    }

    public static RideEvent of(Ride ride, HistoryEntry entry) {
        return RideEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .rideId(ride.getId())
                .riderId(ride.getRiderId())
                .driverId(ride.getDriverId())
                .eventType(typeOf(entry))
                .status(ride.getStatus())
                .totalFare(ride.getFare() != null ? ride.getFare().getTotalFare() : null)
                .details(entry.getDetails())
                .timestamp(entry.getTimestamp())
                .build();
    }

    private static EventType typeOf(HistoryEntry entry) {
        return switch (entry.getAction()) {
            case CREATED -> EventType.REQUESTED;
            case ACCEPTED -> EventType.DRIVER_ASSIGNED;
            case STARTED -> EventType.TRIP_STARTED;
            case DESTINATION_UPDATED -> EventType.DESTINATION_UPDATED;
            case COMPLETED -> EventType.TRIP_COMPLETED;
            case CANCELLED -> EventType.CANCELLED;
        };
    }
}
