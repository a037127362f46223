package com.example.workscheduler.domain.entity;

import com.example.workscheduler.domain.enums.ScheduleType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A message on the job queue. Its id is the dispatch id handed back to callers.
 */
@Entity
@Table(name = "job_queue", indexes = {
        @Index(name = "idx_job_queue_enqueued_at", columnList = "enqueued_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueuedJob {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 20)
    private ScheduleType scheduleType;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    /**
     * Instance that produced the message
     */
    @Column(name = "enqueued_by", length = 100)
    private String enqueuedBy;
}
