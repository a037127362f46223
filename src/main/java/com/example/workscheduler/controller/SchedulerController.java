package com.example.workscheduler.controller;

import com.example.workscheduler.dto.ApiResponse;
import com.example.workscheduler.dto.SchedulerStatus;
import com.example.workscheduler.service.scheduler.SchedulerLoop;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the scheduler loop on this instance.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/scheduler")
@Tag(name = "Scheduler", description = "Scheduler loop status and lifecycle")
public class SchedulerController {

    private final SchedulerLoop schedulerLoop;

    @GetMapping("/status")
    @Operation(summary = "Scheduler status", description = "Loop phase, error count, last tick and lease state")
    public ResponseEntity<ApiResponse<SchedulerStatus>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(schedulerLoop.status()));
    }

    @PostMapping("/start")
    @Operation(summary = "Start the scheduler", description = "Start the loop, or restart it after it disabled itself")
    public ResponseEntity<ApiResponse<SchedulerStatus>> start() {
        log.info("API: Start scheduler");

        schedulerLoop.start();
        return ResponseEntity.ok(ApiResponse.success(schedulerLoop.status(), "Scheduler start requested"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the scheduler", description = "Stop the loop and release the lease")
    public ResponseEntity<ApiResponse<SchedulerStatus>> stop() {
        log.info("API: Stop scheduler");

        schedulerLoop.stop();
        return ResponseEntity.ok(ApiResponse.success(schedulerLoop.status(), "Scheduler stopped"));
    }
}
