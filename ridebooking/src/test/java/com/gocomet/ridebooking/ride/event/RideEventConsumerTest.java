package com.gocomet.ridebooking.ride.event;

import com.gocomet.ridebooking.common.event.RideEvent;
import com.gocomet.ridebooking.common.event.RideEvent.EventType;
import com.gocomet.ridebooking.notification.service.NotificationService;
import com.gocomet.ridebooking.ride.model.RideStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RideEventConsumerTest {

    @Mock
    private NotificationService notificationService;

    @InjectMocks
    private RideEventConsumer consumer;

    private RideEvent event(EventType type, UUID driverId) {
        return RideEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .rideId(UUID.randomUUID())
                .riderId(UUID.randomUUID())
                .driverId(driverId)
                .eventType(type)
                .status(RideStatus.PENDING)
                .build();
    }

    @ParameterizedTest
    @EnumSource(EventType.class)
    @DisplayName("Every event reaches the rider")
    void everyEvent_notifiesRider(EventType type) {
        RideEvent event = event(type, null);

        consumer.consume(event, 0, 0L);

        verify(notificationService).notifyRider(event.getRiderId(), type.name(), event);
        verify(notificationService, never()).notifyDriver(any(), any(), any());
    }

    @ParameterizedTest
    @EnumSource(value = EventType.class, names = {"DRIVER_ASSIGNED", "DESTINATION_UPDATED", "CANCELLED"})
    @DisplayName("Assignment, destination and cancellation events reach the assigned driver")
    void driverFacingEvents_notifyDriver(EventType type) {
        UUID driverId = UUID.randomUUID();
        RideEvent event = event(type, driverId);

        consumer.consume(event, 1, 42L);

        verify(notificationService).notifyDriver(driverId, type.name(), event);
    }

    @Test
    @DisplayName("Trip start is not pushed to the driver who started it")
    void tripStarted_skipsDriver() {
        RideEvent event = event(EventType.TRIP_STARTED, UUID.randomUUID());

        consumer.consume(event, 0, 7L);

        verify(notificationService).notifyRider(eq(event.getRiderId()), eq("TRIP_STARTED"), eq(event));
        verifyNoMoreInteractions(notificationService);
    }
}
