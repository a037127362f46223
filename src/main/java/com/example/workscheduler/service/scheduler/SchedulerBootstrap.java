package com.example.workscheduler.service.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler loop once the application is ready and stops it on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerBootstrap {

    private final SchedulerLoop schedulerLoop;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            schedulerLoop.start();
        } catch (RuntimeException e) {
            log.error("Scheduler failed to start on application ready: {}", e.getMessage(), e);
            throw e;
        }
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Application shutting down, stopping scheduler");
        schedulerLoop.stop();
    }
}
