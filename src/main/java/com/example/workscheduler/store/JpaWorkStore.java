package com.example.workscheduler.store;

import com.example.workscheduler.domain.entity.WorkItem;
import com.example.workscheduler.domain.repository.WorkItemRepository;
import com.example.workscheduler.exception.SchedulerInitializationException;
import com.example.workscheduler.exception.WorkItemNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Work store backed by the {@code work_items} table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaWorkStore implements WorkStore {

    private final WorkItemRepository workItemRepository;
    private final Clock clock;

    @Override
    public void initialize() {
        try {
            var count = workItemRepository.count();
            log.info("Work store ready ({} work items)", count);
        } catch (DataAccessException e) {
            throw new SchedulerInitializationException("work store", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkItem> getDueItems(Instant now, int limit) {
        return workItemRepository.findDueItems(now, limit);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkItem> getItem(UUID itemId, String ownerId) {
        return workItemRepository.findByIdAndOwnerId(itemId, ownerId);
    }

    @Override
    @Transactional
    public WorkItem updateItem(UUID itemId, String ownerId, SchedulePatch patch) {
        var updated = workItemRepository.updateSchedule(itemId, ownerId, patch.nextRun(), patch.lastRunAt(), clock.instant());
        if (updated == 0) {
            throw new WorkItemNotFoundException(itemId, ownerId);
        }

        return workItemRepository.findById(itemId).orElseThrow(() -> new WorkItemNotFoundException(itemId, ownerId));
    }
}
