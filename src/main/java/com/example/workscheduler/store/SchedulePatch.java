package com.example.workscheduler.store;

import java.time.Instant;

/**
 * Fields the scheduler writes back to a work item after dispatching it.
 */
public record SchedulePatch(Instant nextRun, Instant lastRunAt) {
}
