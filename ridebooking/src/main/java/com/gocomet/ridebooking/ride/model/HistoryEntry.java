package com.gocomet.ridebooking.ride.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One line of a ride's audit trail. Written once, never changed.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class HistoryEntry {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private HistoryAction action;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(length = 500)
    private String details;
}
