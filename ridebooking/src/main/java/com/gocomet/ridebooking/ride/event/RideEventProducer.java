package com.gocomet.ridebooking.ride.event;

import com.gocomet.ridebooking.common.event.RideEvent;
import com.gocomet.ridebooking.ride.service.RideTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Publishes every ride transition to the "ride-events" Kafka topic.
 *
 * KEY = rideId, so consumers see a ride's events in history order.
 *
 * Transitions arrive as application events and are sent only once the
 * transaction that wrote them has committed; a rolled-back transition is
 * never published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideEventProducer {

    private final KafkaTemplate<String, RideEvent> kafkaTemplate;

    @Value("${app.kafka.topics.ride-events}")
    private String topic;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void publish(RideTransition transition) {
        publish(RideEvent.of(transition.getRide(), transition.getEntry()));
    }

    private void publish(RideEvent event) {
        String key = event.getRideId().toString();
        kafkaTemplate.send(topic, key, event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish RideEvent [{}] for ride {}",
                                event.getEventType(), event.getRideId(), ex);
                    } else {
                        log.debug("Published RideEvent [{}] for ride {} → partition {}, offset {}",
                                event.getEventType(),
                                event.getRideId(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    }
                });
    }
}
