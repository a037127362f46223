package com.example.workscheduler.store;

import com.example.workscheduler.domain.entity.WorkItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Access to the shared collection of recurring work items.
 */
public interface WorkStore {

    /**
     * Verify the store is reachable.
     *
     * @throws com.example.workscheduler.exception.SchedulerInitializationException if it is not
     */
    void initialize();

    /**
     * Enabled items with {@code nextRun <= now}, ascending by next run, at most {@code limit}.
     */
    List<WorkItem> getDueItems(Instant now, int limit);

    Optional<WorkItem> getItem(UUID itemId, String ownerId);

    /**
     * Apply a partial schedule update.
     *
     * @throws com.example.workscheduler.exception.WorkItemNotFoundException if the item is missing or the owner does not match
     */
    WorkItem updateItem(UUID itemId, String ownerId, SchedulePatch patch);
}
