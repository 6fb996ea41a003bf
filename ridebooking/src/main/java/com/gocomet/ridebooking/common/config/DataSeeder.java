package com.gocomet.ridebooking.common.config;

import com.gocomet.ridebooking.rider.model.Rider;
import com.gocomet.ridebooking.rider.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds demo riders on startup so the API can be exercised without registering first.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final RiderRepository riderRepository;

    @Override
    public void run(String... args) {
        if (riderRepository.count() > 0) {
            log.info("Database already seeded. Skipping.");
            return;
        }

        log.info("Seeding database with test data...");

        riderRepository.save(Rider.builder()
                .name("Ashish")
                .email("ashish@test.com")
                .phone("9876543210")
                .build());

        riderRepository.save(Rider.builder()
                .name("Priya")
                .email("priya@test.com")
                .phone("9876543211")
                .build());

        log.info("Seeded {} riders", riderRepository.count());
    }
}
