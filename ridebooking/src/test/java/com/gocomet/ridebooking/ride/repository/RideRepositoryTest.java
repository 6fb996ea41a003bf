package com.gocomet.ridebooking.ride.repository;

import com.gocomet.ridebooking.fare.config.FareProperties;
import com.gocomet.ridebooking.fare.model.Location;
import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.fare.service.FareEstimator;
import com.gocomet.ridebooking.ride.command.AcceptRide;
import com.gocomet.ridebooking.ride.command.CancelRide;
import com.gocomet.ridebooking.ride.command.CreateRide;
import com.gocomet.ridebooking.ride.command.StartRide;
import com.gocomet.ridebooking.ride.command.UpdateDestination;
import com.gocomet.ridebooking.ride.model.HistoryAction;
import com.gocomet.ridebooking.ride.model.HistoryEntry;
import com.gocomet.ridebooking.ride.model.Ride;
import com.gocomet.ridebooking.ride.model.RideStatus;
import com.gocomet.ridebooking.ride.service.RideLifecycleManager;
import com.gocomet.ridebooking.rider.model.Rider;
import com.gocomet.ridebooking.rider.repository.RiderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class RideRepositoryTest {

    private static final Location PICKUP = Location.of("Bandra West", 19.0760, 72.8777);
    private static final Location DROP = Location.of("Khar West", 19.0896, 72.8656);
    private static final Location FAR_DROP = Location.of("Santacruz East", 19.1350, 72.8656);
    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private RideRepository rideRepository;

    @Autowired
    private RiderRepository riderRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final FareEstimator estimator = new FareEstimator(new BigDecimal("15"));

    private RideLifecycleManager managerAt(int minutesAfterStart) {
        Clock clock = Clock.fixed(T0.plusSeconds(minutesAfterStart * 60L), ZoneOffset.UTC);
        return new RideLifecycleManager(estimator, new FareProperties(), clock);
    }

    private Ride newRide(UUID riderId, int minutesAfterStart) {
        return managerAt(minutesAfterStart).create(CreateRide.builder()
                .riderId(riderId).pickup(PICKUP).drop(DROP).category(RideCategory.ECONOMY).build()).getRide();
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    @DisplayName("A ride is stored with its fare, locations and history in order")
    void save_persistsHistoryInOrder() {
        UUID riderId = UUID.randomUUID();
        Ride ride = newRide(riderId, 0);
        UUID driverId = UUID.randomUUID();
        managerAt(1).apply(ride, new AcceptRide(driverId));
        managerAt(2).apply(ride, new StartRide(driverId));
        managerAt(3).apply(ride, new UpdateDestination(riderId, FAR_DROP));
        rideRepository.save(ride);
        flushAndClear();

        Ride loaded = rideRepository.findById(ride.getId()).orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(RideStatus.STARTED);
        assertThat(loaded.getDropLocation()).isEqualTo(FAR_DROP);
        assertThat(loaded.getOriginalDropLocation()).isEqualTo(DROP);
        assertThat(loaded.getDistanceKm()).isEqualTo(6.68);
        assertThat(loaded.getFare().getCurrency()).isEqualTo("INR");
        assertThat(loaded.getFare().getTotalFare()).isEqualByComparingTo(ride.getFare().getTotalFare());
        assertThat(loaded.getHistory())
                .extracting(HistoryEntry::getAction)
                .containsExactly(HistoryAction.CREATED, HistoryAction.ACCEPTED,
                        HistoryAction.STARTED, HistoryAction.DESTINATION_UPDATED);
        assertThat(loaded.getVersion()).isNotNull();
    }

    @Test
    @DisplayName("Ownership lookup does not return another rider's ride")
    void findByIdAndRiderId_scopedToOwner() {
        UUID owner = UUID.randomUUID();
        Ride ride = rideRepository.save(newRide(owner, 0));
        flushAndClear();

        assertThat(rideRepository.findByIdAndRiderId(ride.getId(), owner)).isPresent();
        assertThat(rideRepository.findByIdAndRiderId(ride.getId(), UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("Active lookup ignores cancelled rides")
    void findActive_ignoresTerminal() {
        UUID riderId = UUID.randomUUID();
        Ride cancelled = newRide(riderId, 0);
        managerAt(1).apply(cancelled, new CancelRide(riderId, null));
        rideRepository.save(cancelled);
        flushAndClear();

        assertThat(rideRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(riderId, RideStatus.ACTIVE))
                .isEmpty();

        Ride pending = rideRepository.save(newRide(riderId, 5));
        flushAndClear();

        assertThat(rideRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(riderId, RideStatus.ACTIVE))
                .get().extracting(Ride::getId).isEqualTo(pending.getId());
    }

    @Test
    @DisplayName("History pages are newest first and can be filtered by status")
    void findByRiderId_pagedNewestFirst() {
        UUID riderId = UUID.randomUUID();
        for (int i = 0; i < 4; i++) {
            Ride ride = newRide(riderId, i * 10);
            managerAt(i * 10 + 1).apply(ride, new CancelRide(riderId, "test " + i));
            rideRepository.save(ride);
        }
        Ride latest = rideRepository.save(newRide(riderId, 100));
        rideRepository.save(newRide(UUID.randomUUID(), 200));
        flushAndClear();

        PageRequest firstPage = PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Ride> page = rideRepository.findByRiderId(riderId, firstPage);

        assertThat(page.getTotalElements()).isEqualTo(5);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getContent()).hasSize(2);
        assertThat(page.getContent().get(0).getId()).isEqualTo(latest.getId());
        assertThat(page.getContent().get(1).getCancellationReason()).isEqualTo("test 3");

        Page<Ride> cancelled = rideRepository.findByRiderIdAndStatus(riderId, RideStatus.CANCELLED,
                PageRequest.of(0, 10, Sort.by(Sort.Direction.DESC, "createdAt")));
        assertThat(cancelled.getTotalElements()).isEqualTo(4);
        assertThat(cancelled.getContent())
                .extracting(Ride::getCancellationReason)
                .containsExactly("test 3", "test 2", "test 1", "test 0");
    }

    @Test
    @DisplayName("Rider row can be locked for a booking")
    void findByIdForUpdate_returnsRider() {
        Rider rider = riderRepository.save(Rider.builder()
                .name("Ashish")
                .email("ashish@test.com")
                .phone("9876543210")
                .build());
        flushAndClear();

        assertThat(riderRepository.findByIdForUpdate(rider.getId()))
                .get().extracting(Rider::getEmail).isEqualTo("ashish@test.com");
        assertThat(riderRepository.findByIdForUpdate(UUID.randomUUID())).isEmpty();
    }
}
