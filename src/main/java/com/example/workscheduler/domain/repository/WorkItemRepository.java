package com.example.workscheduler.domain.repository;

import com.example.workscheduler.domain.entity.WorkItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for WorkItem entity.
 */
@Repository
public interface WorkItemRepository extends JpaRepository<WorkItem, UUID> {

    /**
     * Find enabled items whose next run has arrived, most overdue first.
     */
    @Query(value = """
            SELECT w.* FROM work_items w
            WHERE w.schedule_enabled = TRUE
              AND w.schedule_next_run <= :now
            ORDER BY w.schedule_next_run ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<WorkItem> findDueItems(@Param("now") Instant now, @Param("limit") int limit);

    Optional<WorkItem> findByIdAndOwnerId(UUID id, String ownerId);

    /**
     * Advance an item's schedule after a dispatch.
     *
     * @return number of rows updated (0 if the item is gone or owned by someone else)
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE WorkItem w
            SET w.schedule.nextRun = :nextRun,
                w.lastRunAt = :lastRunAt,
                w.updatedAt = :now,
                w.version = w.version + 1
            WHERE w.id = :id
              AND w.ownerId = :ownerId
            """)
    int updateSchedule(
            @Param("id") UUID id,
            @Param("ownerId") String ownerId,
            @Param("nextRun") Instant nextRun,
            @Param("lastRunAt") Instant lastRunAt,
            @Param("now") Instant now);
}
