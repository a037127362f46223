package com.example.workscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * A recurring work definition owned by a user.
 * <p>
 * Created and edited elsewhere; the scheduler only reads eligibility and
 * writes {@code schedule.nextRun} and {@code lastRunAt}.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "work_items", indexes = {
        @Index(name = "idx_work_item_due", columnList = "schedule_enabled, schedule_next_run"),
        @Index(name = "idx_work_item_owner", columnList = "owner_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "name", length = 200)
    private String name;

    @Embedded
    private WorkSchedule schedule;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
