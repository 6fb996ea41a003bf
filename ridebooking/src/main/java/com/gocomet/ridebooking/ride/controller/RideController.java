package com.gocomet.ridebooking.ride.controller;

import com.gocomet.ridebooking.common.dto.ApiResponse;
import com.gocomet.ridebooking.common.web.IdentityHeaders;
import com.gocomet.ridebooking.fare.model.FareQuote;
import com.gocomet.ridebooking.ride.dto.*;
import com.gocomet.ridebooking.ride.service.RideService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/rides")
@RequiredArgsConstructor
public class RideController {

    private final RideService rideService;

    /**
     * GET /v1/rides/estimate — Estimate fare before booking
     */
    @GetMapping("/estimate")
    public ResponseEntity<ApiResponse<FareQuote>> estimate(@Valid @ModelAttribute FareEstimateQuery query) {
        FareQuote quote = rideService.estimateFare(query.pickup(), query.drop(), query.getRideType());
        return ResponseEntity.ok(ApiResponse.ok("Fare estimated successfully", quote));
    }

    /**
     * POST /v1/rides/book — Book a ride
     */
    @PostMapping("/book")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> book(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @Valid @RequestBody RideBookingRequest request) {

        RideDetailsResponse response = rideService.bookRide(riderId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Ride booked successfully. Looking for nearby drivers...", response));
    }

    /**
     * GET /v1/rides/{id}/status — Current ride status
     */
    @GetMapping("/{id}/status")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> status(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @PathVariable UUID id) {

        RideResponse ride = rideService.getRide(riderId, id);
        return ResponseEntity.ok(ApiResponse.ok("Ride status retrieved successfully", RideDetailsResponse.of(ride)));
    }

    /**
     * PUT /v1/rides/{id}/update-destination — Change destination of an accepted or started ride
     */
    @PutMapping("/{id}/update-destination")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> updateDestination(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @PathVariable UUID id,
            @Valid @RequestBody DestinationUpdateRequest request) {

        RideDetailsResponse response = rideService.updateDestination(riderId, id, request.getDropLocation().toLocation());
        return ResponseEntity.ok(ApiResponse.ok("Destination updated successfully", response));
    }

    /**
     * POST /v1/rides/{id}/cancel — Cancel a pending or accepted ride
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> cancel(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) CancelRideRequest request) {

        String reason = request != null ? request.getReason() : null;
        RideResponse ride = rideService.cancelRide(riderId, id, reason);
        return ResponseEntity.ok(ApiResponse.ok("Ride cancelled successfully", RideDetailsResponse.of(ride)));
    }

    /**
     * GET /v1/rides/history — Past rides of the rider, newest first
     */
    @GetMapping("/history")
    public ResponseEntity<ApiResponse<RideHistoryResponse>> history(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @Valid @ModelAttribute RideHistoryQuery query) {

        RideHistoryResponse response = rideService.getRideHistory(
                riderId, query.getPage(), query.getLimit(), query.getStatus());
        return ResponseEntity.ok(ApiResponse.ok("Ride history retrieved successfully", response));
    }

    /**
     * GET /v1/rides/active — Current non-terminal ride
     */
    @GetMapping("/active")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> active(@RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId) {
        RideResponse ride = rideService.getActiveRide(riderId);
        return ResponseEntity.ok(ApiResponse.ok("Active ride retrieved successfully", RideDetailsResponse.of(ride)));
    }

    /**
     * POST /v1/rides/{id}/accept — Driver accepts a pending ride
     */
    @PostMapping("/{id}/accept")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> accept(
            @RequestHeader(IdentityHeaders.DRIVER_ID) UUID driverId,
            @PathVariable UUID id) {

        RideResponse ride = rideService.acceptRide(driverId, id);
        return ResponseEntity.ok(ApiResponse.ok("Ride accepted", RideDetailsResponse.of(ride)));
    }

    /**
     * POST /v1/rides/{id}/start — Assigned driver starts the ride
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> start(
            @RequestHeader(IdentityHeaders.DRIVER_ID) UUID driverId,
            @PathVariable UUID id) {

        RideResponse ride = rideService.startRide(driverId, id);
        return ResponseEntity.ok(ApiResponse.ok("Ride started", RideDetailsResponse.of(ride)));
    }

    /**
     * POST /v1/rides/{id}/complete — Assigned driver completes the ride
     */
    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse<RideDetailsResponse>> complete(
            @RequestHeader(IdentityHeaders.DRIVER_ID) UUID driverId,
            @PathVariable UUID id) {

        RideResponse ride = rideService.completeRide(driverId, id);
        return ResponseEntity.ok(ApiResponse.ok("Ride completed", RideDetailsResponse.of(ride)));
    }
}
