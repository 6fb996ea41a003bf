package com.gocomet.ridebooking.ride.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.ride.model.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RideResponse {

    private UUID id;
    private UUID riderId;
    private UUID driverId;
    private RideStatus status;
    private RideCategory rideCategory;
    private Location pickupLocation;
    private Location dropLocation;
    private Location originalDropLocation;
    private double distanceKm;
    private Integer estimatedMinutes;
    private Fare fare;
    private PaymentMethod paymentMethod;
    private PaymentStatus paymentStatus;
    private LocalDateTime rideStartTime;
    private LocalDateTime rideEndTime;
    private Long actualDurationMinutes;
    private String cancellationReason;
    private CancelledBy cancelledBy;
    private String notes;
    private List<HistoryEntry> history;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static RideResponse from(Ride ride) {
        return RideResponse.builder()
                .id(ride.getId())
                .riderId(ride.getRiderId())
                .driverId(ride.getDriverId())
                .status(ride.getStatus())
                .rideCategory(ride.getRideCategory())
                .pickupLocation(ride.getPickupLocation())
                .dropLocation(ride.getDropLocation())
                .originalDropLocation(ride.getOriginalDropLocation())
                .distanceKm(ride.getDistanceKm())
                .estimatedMinutes(ride.getEstimatedMinutes())
                .fare(ride.getFare())
                .paymentMethod(ride.getPaymentMethod())
                .paymentStatus(ride.getPaymentStatus())
                .rideStartTime(ride.getRideStartTime())
                .rideEndTime(ride.getRideEndTime())
                .actualDurationMinutes(ride.getActualDurationMinutes())
                .cancellationReason(ride.getCancellationReason())
                .cancelledBy(ride.getCancelledBy())
                .notes(ride.getNotes())
                .history(List.copyOf(ride.getHistory()))
                .createdAt(ride.getCreatedAt())
                .updatedAt(ride.getUpdatedAt())
                .build();
    }
}
