package com.gocomet.ridebooking.ride.service;

import com.gocomet.ridebooking.common.exception.ActiveRideConflictException;
import com.gocomet.ridebooking.common.exception.ResourceNotFoundException;
import com.gocomet.ridebooking.common.exception.RideNotModifiableException;
import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.fare.service.FareEstimator;
import com.gocomet.ridebooking.ride.command.*;
import com.gocomet.ridebooking.ride.dto.*;
import com.gocomet.ridebooking.ride.model.Ride;
import com.gocomet.ridebooking.ride.model.RideStatus;
import com.gocomet.ridebooking.ride.repository.RideRepository;
import com.gocomet.ridebooking.rider.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RideService {

    private final RideRepository rideRepository;
    private final RiderRepository riderRepository;
    private final RideLifecycleManager lifecycleManager;
    private final FareEstimator fareEstimator;
    private final ApplicationEventPublisher eventPublisher;

    public FareQuote estimateFare(Location pickup, Location drop, RideCategory category) {
        return fareEstimator.quote(pickup, drop, category);
    }

    /**
     * Book a ride.
     * 1. Lock the rider row (serialises concurrent bookings by one rider)
     * 2. Reject if the rider already has an active ride
     * 3. Create the ride through the lifecycle manager
     * 4. Save; REQUESTED is published after commit
     */
    @Transactional
    public RideDetailsResponse bookRide(UUID riderId, RideBookingRequest request) {
        riderRepository.findByIdForUpdate(riderId)
                .orElseThrow(() -> new ResourceNotFoundException("Rider", "id", riderId));

        rideRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(riderId, RideStatus.ACTIVE)
                .ifPresent(active -> {
                    log.info("Rider {} already has active ride {}", riderId, active.getId());
                    throw new ActiveRideConflictException(active.getId());
                });

        RideTransition transition = lifecycleManager.create(CreateRide.builder()
                .riderId(riderId)
                .pickup(request.getPickupLocation().toLocation())
                .drop(request.getDropLocation().toLocation())
                .category(request.getRideType() != null ? request.getRideType() : RideCategory.ECONOMY)
                .paymentMethod(request.getPaymentMethod())
                .notes(request.getNotes())
                .build());

        Ride ride = rideRepository.save(transition.getRide());
        log.info("Ride {} created for rider {} ({} km, fare {})",
                ride.getId(), riderId, ride.getDistanceKm(), ride.getFare().getTotalFare());

        eventPublisher.publishEvent(transition);
        return new RideDetailsResponse(RideResponse.from(ride), transition.getQuote());
    }

    @Transactional(readOnly = true)
    public RideResponse getRide(UUID riderId, UUID rideId) {
        return RideResponse.from(findOwnedRide(riderId, rideId));
    }

    @Transactional
    public RideDetailsResponse updateDestination(UUID riderId, UUID rideId, Location newDrop) {
        RideTransition transition = applyCommand(findModifiableRide(riderId, rideId,
                "Active ride not found or cannot be modified"), new UpdateDestination(riderId, newDrop));
        return new RideDetailsResponse(RideResponse.from(transition.getRide()), transition.getQuote());
    }

    @Transactional
    public RideResponse cancelRide(UUID riderId, UUID rideId, String reason) {
        RideTransition transition = applyCommand(findModifiableRide(riderId, rideId,
                "Ride not found or cannot be cancelled"), new CancelRide(riderId, reason));
        return RideResponse.from(transition.getRide());
    }

    @Transactional
    public RideResponse acceptRide(UUID driverId, UUID rideId) {
        return RideResponse.from(applyCommand(findRide(rideId), new AcceptRide(driverId)).getRide());
    }

    @Transactional
    public RideResponse startRide(UUID driverId, UUID rideId) {
        return RideResponse.from(applyCommand(findRide(rideId), new StartRide(driverId)).getRide());
    }

    @Transactional
    public RideResponse completeRide(UUID driverId, UUID rideId) {
        return RideResponse.from(applyCommand(findRide(rideId), new CompleteRide(driverId)).getRide());
    }

    /**
     * Rides of the rider, newest first. {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public RideHistoryResponse getRideHistory(UUID riderId, int page, int limit, RideStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Ride> rides = status != null
                ? rideRepository.findByRiderIdAndStatus(riderId, status, pageable)
                : rideRepository.findByRiderId(riderId, pageable);

        return RideHistoryResponse.builder()
                .rides(rides.map(RideResponse::from).getContent())
                .pagination(PaginationInfo.builder()
                        .currentPage(page)
                        .totalPages(rides.getTotalPages())
                        .totalRides(rides.getTotalElements())
                        .hasNextPage(page < rides.getTotalPages())
                        .hasPrevPage(page > 1)
                        .build())
                .build();
    }

    @Transactional(readOnly = true)
    public RideResponse getActiveRide(UUID riderId) {
        return rideRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(riderId, RideStatus.ACTIVE)
                .map(RideResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("No active ride found"));
    }

    private RideTransition applyCommand(Ride ride, RideCommand command) {
        RideTransition transition = lifecycleManager.apply(ride, command);
        rideRepository.save(transition.getRide());
        log.info("Ride {} → {} ({})", ride.getId(), ride.getStatus(), transition.getEntry().getAction());
        eventPublisher.publishEvent(transition);
        return transition;
    }

    private Ride findRide(UUID rideId) {
        return rideRepository.findById(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
    }

    private Ride findOwnedRide(UUID riderId, UUID rideId) {
        return rideRepository.findByIdAndRiderId(rideId, riderId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride not found"));
    }

    // Another rider's ride is reported exactly like a ride in the wrong status
    private Ride findModifiableRide(UUID riderId, UUID rideId, String message) {
        return rideRepository.findByIdAndRiderId(rideId, riderId)
                .orElseThrow(() -> new RideNotModifiableException(message));
    }
}
