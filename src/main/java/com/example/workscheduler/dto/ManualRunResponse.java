package com.example.workscheduler.dto;

import com.example.workscheduler.domain.enums.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Result of a manual trigger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRunResponse {

    private UUID itemId;
    private String dispatchId;
    private ScheduleType scheduleType;
}
