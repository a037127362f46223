package com.example.workscheduler.service.scheduler;

import com.example.workscheduler.domain.enums.SchedulerPhase;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the loop has disabled itself after repeated tick failures.
 * A loop stopped by configuration or by an operator is not a health problem.
 */
@Component("scheduler")
@RequiredArgsConstructor
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerLoop schedulerLoop;

    @Override
    public Health health() {
        var status = schedulerLoop.status();
        var builder = status.getPhase() == SchedulerPhase.DISABLED ? Health.down() : Health.up();

        builder.withDetail("phase", status.getPhase().getCode())
                .withDetail("instanceId", status.getInstanceId())
                .withDetail("consecutiveErrors", status.getConsecutiveErrorCount())
                .withDetail("maxConsecutiveErrors", status.getMaxConsecutiveErrors())
                .withDetail("leaseStatus", status.getLease().getStatus());

        if (status.getLastTickTime() != null) {
            builder.withDetail("lastTickTime", status.getLastTickTime().toString());
        }
        if (status.getLastError() != null) {
            builder.withDetail("lastError", status.getLastError());
        }
        return builder.build();
    }
}
