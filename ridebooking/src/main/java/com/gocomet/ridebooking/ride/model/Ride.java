package com.gocomet.ridebooking.ride.model;

import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Ride aggregate. State changes go through
 * {@link com.gocomet.ridebooking.ride.service.RideLifecycleManager}; history is append-only.
 */
@Entity
@Table(name = "rides", indexes = {
        @Index(name = "idx_rides_rider_created", columnList = "rider_id, created_at"),
        @Index(name = "idx_rides_rider_status", columnList = "rider_id, status"),
        @Index(name = "idx_rides_driver_status", columnList = "driver_id, status"),
        @Index(name = "idx_rides_status_created", columnList = "status, created_at")
})
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Ride {

    @Id
    @Setter(AccessLevel.NONE)
    private UUID id;

    @Column(name = "rider_id", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private UUID riderId;

    @Column(name = "driver_id")
    private UUID driverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RideStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "ride_category", nullable = false, length = 16)
    private RideCategory rideCategory;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "address", column = @Column(name = "pickup_address", nullable = false, updatable = false)),
            @AttributeOverride(name = "coordinates.latitude", column = @Column(name = "pickup_lat", nullable = false, updatable = false)),
            @AttributeOverride(name = "coordinates.longitude", column = @Column(name = "pickup_lng", nullable = false, updatable = false))
    })
    @Setter(AccessLevel.NONE)
    private Location pickupLocation;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "address", column = @Column(name = "drop_address", nullable = false)),
            @AttributeOverride(name = "coordinates.latitude", column = @Column(name = "drop_lat", nullable = false)),
            @AttributeOverride(name = "coordinates.longitude", column = @Column(name = "drop_lng", nullable = false))
    })
    private Location dropLocation;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "address", column = @Column(name = "original_drop_address", updatable = false)),
            @AttributeOverride(name = "coordinates.latitude", column = @Column(name = "original_drop_lat", updatable = false)),
            @AttributeOverride(name = "coordinates.longitude", column = @Column(name = "original_drop_lng", updatable = false))
    })
    @Setter(AccessLevel.NONE)
    private Location originalDropLocation;

    @Column(name = "distance_km", nullable = false)
    private double distanceKm;

    @Column(name = "estimated_minutes")
    private Integer estimatedMinutes;

    @Embedded
    private Fare fare;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 16)
    @Builder.Default
    private PaymentMethod paymentMethod = PaymentMethod.CASH;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Column(name = "ride_start_time")
    private LocalDateTime rideStartTime;

    @Column(name = "ride_end_time")
    private LocalDateTime rideEndTime;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 16)
    private CancelledBy cancelledBy;

    @Column(length = 500)
    private String notes;

    @ElementCollection
    @CollectionTable(name = "ride_history", joinColumns = @JoinColumn(name = "ride_id"))
    @OrderColumn(name = "seq")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Setter(AccessLevel.NONE)
    private Long version;

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void appendHistory(HistoryEntry entry) {
        history.add(entry);
    }

    /**
     * Whole minutes between start and end, rounded up; null until the ride has both.
     */
    public Long getActualDurationMinutes() {
        if (rideStartTime == null || rideEndTime == null) {
            return null;
        }
        long seconds = Duration.between(rideStartTime, rideEndTime).getSeconds();
        return (seconds + 59) / 60;
    }
}
