package com.example.workscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Work Scheduler Service Application
 * <p>
 * Polls the shared work store for recurring work items that are due and
 * dispatches them to the job queue, coordinating multiple replicas through
 * a single lease record.
 * <p>
 * Features:
 * - Lease-based mutual exclusion between instances
 * - Monotonic next-run advancement for recurring items
 * - Self-disabling loop after repeated tick failures
 * - Lock-independent manual trigger path
 * - Slack alerting when the loop disables itself
 */
@EnableScheduling
@SpringBootApplication
public class WorkSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkSchedulerApplication.class, args);
    }
}
