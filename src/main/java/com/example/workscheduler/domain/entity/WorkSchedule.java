package com.example.workscheduler.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Recurrence settings of a work item.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkSchedule {

    @Column(name = "schedule_enabled", nullable = false)
    private boolean enabled;

    /**
     * Hours between runs, always positive
     */
    @Column(name = "schedule_interval_hours", nullable = false)
    private int intervalHours;

    /**
     * Earliest time the item may be dispatched again
     */
    @Column(name = "schedule_next_run")
    private Instant nextRun;

    /**
     * Next run after a dispatch at {@code dispatchTime}. Always strictly after it.
     */
    public Instant nextRunAfter(Instant dispatchTime) {
        if (intervalHours <= 0) {
            throw new IllegalStateException("Schedule interval must be positive, was " + intervalHours);
        }
        return dispatchTime.plus(Duration.ofHours(intervalHours));
    }
}
