package com.gocomet.ridebooking.rider.service;

import com.gocomet.ridebooking.common.exception.DuplicateResourceException;
import com.gocomet.ridebooking.common.exception.ResourceNotFoundException;
import com.gocomet.ridebooking.rider.dto.RiderProfileUpdateRequest;
import com.gocomet.ridebooking.rider.dto.RiderRegistrationRequest;
import com.gocomet.ridebooking.rider.dto.RiderResponse;
import com.gocomet.ridebooking.rider.model.Rider;
import com.gocomet.ridebooking.rider.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RiderService {

    private final RiderRepository riderRepository;

    @Transactional
    public RiderResponse register(RiderRegistrationRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);

        if (riderRepository.existsByEmail(email)) {
            throw new DuplicateResourceException("User with this email already exists");
        }
        if (riderRepository.existsByPhone(request.getPhone())) {
            throw new DuplicateResourceException("User with this phone number already exists");
        }

        Rider rider = riderRepository.save(Rider.builder()
                .name(request.getName().trim())
                .email(email)
                .phone(request.getPhone())
                .build());

        log.info("Registered rider {}", rider.getId());
        return toResponse(rider);
    }

    @Transactional
    public RiderResponse updateProfile(UUID riderId, RiderProfileUpdateRequest request) {
        Rider rider = riderRepository.findById(riderId)
                .orElseThrow(() -> new ResourceNotFoundException("Rider", "id", riderId));

        if (request.getPhone() != null && !request.getPhone().equals(rider.getPhone())) {
            if (riderRepository.existsByPhoneAndIdNot(request.getPhone(), riderId)) {
                throw new DuplicateResourceException("Phone number is already registered with another account");
            }
            rider.setPhone(request.getPhone());
        }
        if (request.getName() != null && !request.getName().isBlank()) {
            rider.setName(request.getName().trim());
        }

        Rider saved = riderRepository.save(rider);
        log.info("Updated profile of rider {}", riderId);
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public RiderResponse getRider(UUID riderId) {
        return riderRepository.findById(riderId)
                .map(this::toResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Rider", "id", riderId));
    }

    @Transactional(readOnly = true)
    public List<RiderResponse> getAllRiders() {
        return riderRepository.findAll()
                .stream()
                .map(this::toResponse)
                .toList();
    }

    private RiderResponse toResponse(Rider rider) {
        return RiderResponse.builder()
                .id(rider.getId())
                .name(rider.getName())
                .email(rider.getEmail())
                .phone(rider.getPhone())
                .createdAt(rider.getCreatedAt())
                .build();
    }
}
