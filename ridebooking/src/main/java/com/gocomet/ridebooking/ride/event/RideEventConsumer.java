package com.gocomet.ridebooking.ride.event;

import com.gocomet.ridebooking.common.event.RideEvent;
import com.gocomet.ridebooking.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Consumes ride events and pushes them to the rider (and the assigned driver,
 * once there is one) over WebSocket.
 *
 * Consumer group "ride-notifier". Events arrive in per-ride order because they
 * are keyed by rideId.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideEventConsumer {

    private final NotificationService notificationService;

    @KafkaListener(topics = "${app.kafka.topics.ride-events}", groupId = "ride-notifier")
    public void consume(
            @Payload RideEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("RideEvent [{}] rideId={}, riderId={}, driverId={} | partition={}, offset={}",
                event.getEventType(),
                event.getRideId(),
                event.getRiderId(),
                event.getDriverId(),
                partition,
                offset);

        notificationService.notifyRider(event.getRiderId(), event.getEventType().name(), event);

        switch (event.getEventType()) {
            case DRIVER_ASSIGNED, DESTINATION_UPDATED, CANCELLED -> {
                if (event.getDriverId() != null) {
                    notificationService.notifyDriver(event.getDriverId(), event.getEventType().name(), event);
                }
            }
            default -> log.debug("No driver notification for event {}", event.getEventType());
        }
    }
}
