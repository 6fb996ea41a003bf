package com.gocomet.ridebooking.ride.repository;

import com.gocomet.ridebooking.ride.model.Ride;
import com.gocomet.ridebooking.ride.model.RideStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RideRepository extends JpaRepository<Ride, UUID> {
    Optional<Ride> findByIdAndRiderId(UUID id, UUID riderId);
    Optional<Ride> findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(UUID riderId, Collection<RideStatus> statuses);
    Page<Ride> findByRiderId(UUID riderId, Pageable pageable);
    Page<Ride> findByRiderIdAndStatus(UUID riderId, RideStatus status, Pageable pageable);
}
