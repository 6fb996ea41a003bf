package com.gocomet.ridebooking.rider.controller;

import com.gocomet.ridebooking.common.dto.ApiResponse;
import com.gocomet.ridebooking.common.web.IdentityHeaders;
import com.gocomet.ridebooking.rider.dto.RiderProfileUpdateRequest;
import com.gocomet.ridebooking.rider.dto.RiderRegistrationRequest;
import com.gocomet.ridebooking.rider.dto.RiderResponse;
import com.gocomet.ridebooking.rider.service.RiderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/riders")
@RequiredArgsConstructor
public class RiderController {

    private final RiderService riderService;

    /**
     * POST /v1/riders — Register a rider
     */
    @PostMapping
    public ResponseEntity<ApiResponse<RiderResponse>> register(@Valid @RequestBody RiderRegistrationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("User registered successfully", riderService.register(request)));
    }

    /**
     * GET /v1/riders — List all riders (for demo/frontend selection)
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<RiderResponse>>> getRiders() {
        return ResponseEntity.ok(ApiResponse.ok("Riders retrieved successfully", riderService.getAllRiders()));
    }

    /**
     * GET /v1/riders/me — Profile of the calling rider
     */
    @GetMapping("/me")
    public ResponseEntity<ApiResponse<RiderResponse>> me(@RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId) {
        return ResponseEntity.ok(ApiResponse.ok("Profile retrieved successfully", riderService.getRider(riderId)));
    }

    /**
     * PUT /v1/riders/me — Update name and/or phone of the calling rider
     */
    @PutMapping("/me")
    public ResponseEntity<ApiResponse<RiderResponse>> updateMe(
            @RequestHeader(IdentityHeaders.RIDER_ID) UUID riderId,
            @Valid @RequestBody RiderProfileUpdateRequest request) {

        return ResponseEntity.ok(ApiResponse.ok("Profile updated successfully", riderService.updateProfile(riderId, request)));
    }
}
