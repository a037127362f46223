package com.example.workscheduler.domain.repository;

import com.example.workscheduler.domain.entity.QueuedJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for job queue messages.
 */
@Repository
public interface QueuedJobRepository extends JpaRepository<QueuedJob, UUID> {

    List<QueuedJob> findByItemIdOrderByEnqueuedAtAsc(UUID itemId);

    /**
     * Delete messages enqueued before the cutoff (retention)
     */
    @Modifying
    @Query("DELETE FROM QueuedJob j WHERE j.enqueuedAt < :cutoff")
    int deleteEnqueuedBefore(@Param("cutoff") Instant cutoff);
}
