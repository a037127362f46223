package com.example.workscheduler.controller;

import com.example.workscheduler.domain.enums.ScheduleType;
import com.example.workscheduler.dto.ApiResponse;
import com.example.workscheduler.dto.ManualRunResponse;
import com.example.workscheduler.service.scheduler.SchedulerLoop;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Manual trigger for a single work item.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/work-items")
@Tag(name = "Work Items", description = "Run a work item immediately")
public class WorkItemRunController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final SchedulerLoop schedulerLoop;

    @PostMapping("/{itemId}/run")
    @Operation(summary = "Run now", description = "Enqueue a manual job for the item without changing its schedule")
    public ResponseEntity<ApiResponse<ManualRunResponse>> runNow(
            @Parameter(description = "Work item UUID") @PathVariable UUID itemId,
            @Parameter(description = "Owner of the item") @RequestHeader(OWNER_HEADER) String ownerId) {
        log.info("API: Manual run for item {} by owner {}", itemId, ownerId);

        var dispatchId = schedulerLoop.triggerManualRun(itemId, ownerId);
        var response = ManualRunResponse.builder()
                .itemId(itemId)
                .dispatchId(dispatchId)
                .scheduleType(ScheduleType.MANUAL)
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Run queued"));
    }
}
