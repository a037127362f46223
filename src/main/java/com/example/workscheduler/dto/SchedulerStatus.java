package com.example.workscheduler.dto;

import com.example.workscheduler.domain.enums.SchedulerPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Health snapshot of the scheduler loop on this instance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {

    private SchedulerPhase phase;
    private boolean running;
    private boolean enabled;
    private String instanceId;
    private Instant lastTickTime;
    private int consecutiveErrorCount;
    private int maxConsecutiveErrors;

    /**
     * ISO-8601 duration, e.g. {@code PT5M}
     */
    private String pollInterval;

    private String lastError;
    private boolean dispatcherOpen;
    private LeaseStatus lease;
}
