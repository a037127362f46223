package com.example.workscheduler.store;

import com.example.workscheduler.domain.entity.WorkItem;
import com.example.workscheduler.domain.enums.ScheduleType;

import java.util.UUID;

/**
 * Message handed to the job queue: which item to run, for whom, and why.
 */
public record JobDescriptor(UUID itemId, String ownerId, ScheduleType scheduleType) {

    public static JobDescriptor scheduled(WorkItem item) {
        return new JobDescriptor(item.getId(), item.getOwnerId(), ScheduleType.SCHEDULED);
    }

    public static JobDescriptor manual(UUID itemId, String ownerId) {
        return new JobDescriptor(itemId, ownerId, ScheduleType.MANUAL);
    }
}
