package com.gocomet.ridebooking.notification.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Notify a rider about ride status updates.
     * Frontend subscribes to: /topic/rider/{riderId}
     */
    public void notifyRider(UUID riderId, String eventType, Object payload) {
        send("/topic/rider/" + riderId, eventType, payload);
        log.debug("Notified rider {} with event: {}", riderId, eventType);
    }

    /**
     * Notify the driver assigned to a ride.
     * Frontend subscribes to: /topic/driver/{driverId}
     */
    public void notifyDriver(UUID driverId, String eventType, Object payload) {
        send("/topic/driver/" + driverId, eventType, payload);
        log.debug("Notified driver {} with event: {}", driverId, eventType);
    }

    private void send(String destination, String eventType, Object payload) {
        Map<String, Object> message = Map.of(
                "eventType", eventType,
                "payload", payload
        );
        messagingTemplate.convertAndSend(destination, (Object) message);
    }
}
