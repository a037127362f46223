package com.example.workscheduler.config;

import com.example.workscheduler.domain.enums.ScheduleType;
import com.example.workscheduler.domain.enums.TickOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Tick outcomes and duration
 * - Dispatched jobs by schedule type
 * - Consecutive tick errors
 * - Whether this instance holds the lease
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    private final AtomicLong consecutiveErrors = new AtomicLong(0);
    private final AtomicLong leaseHeld = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("work_scheduler_consecutive_errors", consecutiveErrors, AtomicLong::get)
                .description("Consecutive failed scheduler ticks")
                .register(meterRegistry);

        Gauge.builder("work_scheduler_lease_held", leaseHeld, AtomicLong::get)
                .description("1 when this instance believes it holds the scheduler lease")
                .register(meterRegistry);
    }

    public Timer.Sample startTickTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTick(Timer.Sample sample, TickOutcome outcome) {
        sample.stop(Timer.builder("work_scheduler_tick_duration")
                .tag("outcome", outcome.getCode())
                .description("Scheduler tick duration")
                .register(meterRegistry));
        meterRegistry.counter("work_scheduler_ticks", "outcome", outcome.getCode()).increment();
    }

    public void recordDispatched(ScheduleType scheduleType, int count) {
        meterRegistry.counter("work_scheduler_jobs_dispatched", "schedule_type", scheduleType.getCode()).increment(count);
    }

    public void recordDisabled() {
        meterRegistry.counter("work_scheduler_disabled").increment();
    }

    public void setConsecutiveErrors(int count) {
        consecutiveErrors.set(count);
    }

    public void setLeaseHeld(boolean held) {
        leaseHeld.set(held ? 1 : 0);
    }
}
