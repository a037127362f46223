package com.example.workscheduler.service.maintenance;

import com.example.workscheduler.config.WorkSchedulerProperties;
import com.example.workscheduler.domain.repository.QueuedJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;

/**
 * Purges job queue messages past the retention horizon.
 * <p>
 * ShedLock keeps the purge on one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueMaintenanceService {

    private final QueuedJobRepository queuedJobRepository;
    private final WorkSchedulerProperties properties;
    private final Clock clock;

    @Transactional
    @Scheduled(fixedDelayString = "${work-scheduler.job-queue-purge-interval-ms:3600000}")
    @SchedulerLock(name = "jobQueuePurge", lockAtLeastFor = "1m", lockAtMostFor = "10m")
    public void purgeExpiredJobs() {
        var cutoff = clock.instant().minus(Duration.ofDays(properties.getJobQueueRetentionDays()));

        var deleted = queuedJobRepository.deleteEnqueuedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} job queue messages enqueued before {}", deleted, cutoff);
        } else {
            log.debug("No job queue messages to purge");
        }
    }
}
