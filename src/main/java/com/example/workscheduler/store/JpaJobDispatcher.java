package com.example.workscheduler.store;

import com.example.workscheduler.domain.entity.QueuedJob;
import com.example.workscheduler.domain.repository.QueuedJobRepository;
import com.example.workscheduler.exception.JobDispatchException;
import com.example.workscheduler.exception.SchedulerInitializationException;
import com.example.workscheduler.service.lock.InstanceIdentity;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job queue producer writing one {@code job_queue} row per message.
 * <p>
 * A batch is written in a single transaction: either every message of the
 * batch is enqueued or none is. Transient database failures are retried by
 * the {@code jobQueue} Resilience4j retry instance.
 */
@Slf4j
@Component
public class JpaJobDispatcher implements JobDispatcher {

    private final QueuedJobRepository queuedJobRepository;
    private final TransactionTemplate transactionTemplate;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    private final AtomicBoolean open = new AtomicBoolean(false);

    public JpaJobDispatcher(QueuedJobRepository queuedJobRepository, PlatformTransactionManager transactionManager,
                            InstanceIdentity instanceIdentity, Clock clock) {
        this.queuedJobRepository = queuedJobRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.instanceIdentity = instanceIdentity;
        this.clock = clock;
    }

    /**
     * Probe the queue table and open the producer. Does nothing when already open.
     */
    @Override
    public synchronized void initialize() {
        if (open.get()) {
            return;
        }
        try {
            queuedJobRepository.count();
        } catch (DataAccessException e) {
            throw new SchedulerInitializationException("job queue", e);
        }
        open.set(true);
        log.info("Job queue producer opened for {}", instanceIdentity);
    }

    @Override
    @Retry(name = "jobQueue")
    public String enqueueOne(JobDescriptor job) {
        ensureOpen(1);

        var message = toMessage(job);
        transactionTemplate.executeWithoutResult(status -> queuedJobRepository.save(message));

        log.debug("Enqueued {} job {} for item {}", job.scheduleType().getCode(), message.getId(), job.itemId());
        return message.getId().toString();
    }

    @Override
    @Retry(name = "jobQueue")
    public List<String> enqueueBatch(List<JobDescriptor> jobs) {
        if (jobs.isEmpty()) {
            return List.of();
        }
        ensureOpen(jobs.size());

        var messages = jobs.stream().map(this::toMessage).toList();
        transactionTemplate.executeWithoutResult(status -> queuedJobRepository.saveAll(messages));

        log.debug("Enqueued batch of {} jobs", messages.size());
        return messages.stream().map(m -> m.getId().toString()).toList();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("Job queue producer closed for {}", instanceIdentity);
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    private void ensureOpen(int jobCount) {
        if (!open.get()) {
            throw new JobDispatchException("Job queue producer is closed", jobCount);
        }
    }

    private QueuedJob toMessage(JobDescriptor job) {
        return QueuedJob.builder()
                .id(UUID.randomUUID())
                .itemId(job.itemId())
                .ownerId(job.ownerId())
                .scheduleType(job.scheduleType())
                .enqueuedAt(clock.instant())
                .enqueuedBy(instanceIdentity.getInstanceId())
                .build();
    }
}
