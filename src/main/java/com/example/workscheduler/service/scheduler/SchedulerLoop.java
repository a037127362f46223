package com.example.workscheduler.service.scheduler;

import com.example.workscheduler.config.MetricsConfig;
import com.example.workscheduler.config.WorkSchedulerProperties;
import com.example.workscheduler.domain.entity.WorkItem;
import com.example.workscheduler.domain.enums.ScheduleType;
import com.example.workscheduler.domain.enums.SchedulerPhase;
import com.example.workscheduler.domain.enums.TickOutcome;
import com.example.workscheduler.dto.SchedulerStatus;
import com.example.workscheduler.exception.SchedulerInitializationException;
import com.example.workscheduler.exception.WorkItemNotFoundException;
import com.example.workscheduler.service.alert.SlackAlertService;
import com.example.workscheduler.service.lock.LeaseLock;
import com.example.workscheduler.store.JobDescriptor;
import com.example.workscheduler.store.JobDispatcher;
import com.example.workscheduler.store.SchedulePatch;
import com.example.workscheduler.store.WorkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tick-driven control loop that dispatches due work items.
 * <p>
 * Flow of one tick:
 * 1. Acquire (or confirm) the scheduler lease; skip the tick if another instance holds it
 * 2. Fetch up to batch-size enabled items whose next run has arrived, most overdue first
 * 3. Enqueue one "scheduled" job per item as a single batch
 * 4. Advance each item's next run to dispatch time + interval, concurrently
 * 5. Reset the error counter, stamp the tick time and renew the lease
 * <p>
 * The loop runs on one dedicated thread and waits on a stop signal between
 * ticks, so ticks never overlap within a process and stop() wakes it at once.
 * Tick failures are counted; at {@code max-consecutive-errors} the loop moves
 * to DISABLED, releases the lease and stays there until start() is called.
 */
@Slf4j
@Service
public class SchedulerLoop {

    private final WorkStore workStore;
    private final JobDispatcher jobDispatcher;
    private final LeaseLock leaseLock;
    private final WorkSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;
    private final ExecutorService loopExecutor;
    private final ExecutorService updateExecutor;

    private final AtomicReference<SchedulerPhase> phase = new AtomicReference<>(SchedulerPhase.STOPPED);
    private final AtomicInteger consecutiveErrorCount = new AtomicInteger(0);
    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile Future<?> loopFuture;
    private volatile Instant lastTickTime;
    private volatile String lastError;

    public SchedulerLoop(WorkStore workStore, JobDispatcher jobDispatcher, LeaseLock leaseLock,
                         WorkSchedulerProperties properties, MetricsConfig metricsConfig,
                         SlackAlertService slackAlertService, Clock clock,
                         @Qualifier("schedulerLoopExecutor") ExecutorService loopExecutor,
                         @Qualifier("scheduleUpdateExecutor") ExecutorService updateExecutor) {
        this.workStore = workStore;
        this.jobDispatcher = jobDispatcher;
        this.leaseLock = leaseLock;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.slackAlertService = slackAlertService;
        this.clock = clock;
        this.loopExecutor = loopExecutor;
        this.updateExecutor = updateExecutor;
    }

    // === Lifecycle ===

    /**
     * Initialize dependencies, run one tick immediately and start the loop thread.
     *
     * @throws SchedulerInitializationException if a dependency cannot be initialized
     */
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Scheduling is disabled by configuration, not starting");
            return;
        }
        if (!phase.get().canStart()) {
            log.warn("Scheduler is already {}", phase.get().getCode());
            return;
        }

        log.info("Starting work scheduler on {}...", leaseLock.getInstanceId());
        phase.set(SchedulerPhase.STARTING);

        try {
            validateTiming();
            workStore.initialize();
            jobDispatcher.initialize();
            leaseLock.initialize();
        } catch (SchedulerInitializationException e) {
            phase.set(SchedulerPhase.STOPPED);
            log.error("Failed to start scheduler: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            phase.set(SchedulerPhase.STOPPED);
            log.error("Failed to start scheduler: {}", e.getMessage());
            throw new SchedulerInitializationException("scheduler", e);
        }

        consecutiveErrorCount.set(0);
        metricsConfig.setConsecutiveErrors(0);
        lastError = null;
        stopSignal = new CountDownLatch(1);
        phase.set(SchedulerPhase.RUNNING);

        tick();

        if (phase.get() == SchedulerPhase.RUNNING) {
            loopFuture = loopExecutor.submit(this::runLoop);
            log.info("Work scheduler started (poll interval: {})", properties.getPollInterval());
        }
    }

    /**
     * Stop the loop, wait for an in-flight tick, then release the lease and close the queue producer.
     */
    public synchronized void stop() {
        if (phase.get() == SchedulerPhase.DISABLED) {
            closeDispatcher();
            phase.set(SchedulerPhase.STOPPED);
            return;
        }
        if (!phase.compareAndSet(SchedulerPhase.RUNNING, SchedulerPhase.STOPPING)) {
            return;
        }

        log.info("Stopping work scheduler...");
        stopSignal.countDown();
        awaitLoopExit();

        leaseLock.release();
        closeDispatcher();

        phase.set(SchedulerPhase.STOPPED);
        log.info("Work scheduler stopped");
    }

    private void runLoop() {
        var signal = stopSignal;
        var intervalMs = properties.getPollInterval().toMillis();
        try {
            while (phase.get() == SchedulerPhase.RUNNING) {
                if (signal.await(intervalMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
                tick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Scheduler loop exited ({})", phase.get().getCode());
    }

    private void awaitLoopExit() {
        var future = loopFuture;
        if (future == null) {
            return;
        }

        try {
            future.get(properties.getStopTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("In-flight tick did not finish within {}s, interrupting it", properties.getStopTimeoutSeconds());
            future.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Scheduler loop ended with error: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            loopFuture = null;
        }
    }

    private void closeDispatcher() {
        try {
            jobDispatcher.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close job queue producer: {}", e.getMessage());
        }
    }

    private void validateTiming() {
        var pollInterval = properties.getPollInterval();
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new SchedulerInitializationException("scheduler configuration",
                    String.format("poll interval must be positive, was %s", pollInterval));
        }
        if (properties.getLeaseDuration().compareTo(pollInterval) <= 0) {
            throw new SchedulerInitializationException("scheduler configuration",
                    String.format("lease duration (%ds) must exceed poll interval (%s)",
                            properties.getLeaseDurationSeconds(), pollInterval));
        }
    }

    // === Tick ===

    /**
     * Run one scheduling cycle. Never throws; any failure, {@link Error}s included,
     * counts toward the disable threshold.
     */
    public TickOutcome tick() {
        if (!phase.get().isActive()) {
            log.debug("Scheduler not running, skipping tick");
            return TickOutcome.SKIPPED;
        }

        var sample = metricsConfig.startTickTimer();
        TickOutcome outcome;

        tickLock.lock();
        try {
            outcome = runTick();
        } catch (TickCancelledException e) {
            log.info("Scheduler tick cancelled: stop requested");
            outcome = TickOutcome.CANCELLED;
        } catch (Exception | Error e) {
            recordFailure(e);
            outcome = TickOutcome.FAILED;
        } finally {
            tickLock.unlock();
        }

        metricsConfig.recordTick(sample, outcome);
        return outcome;
    }

    private TickOutcome runTick() {
        if (!leaseLock.acquire()) {
            log.info("Scheduler lease held by another instance, skipping tick");
            return TickOutcome.SKIPPED;
        }
        ensureNotCancelled();

        log.info("Scheduler tick: checking for due work items...");
        var now = clock.instant();
        var dueItems = workStore.getDueItems(now, properties.getBatchSize());

        if (dueItems.isEmpty()) {
            log.info("No due work items found");
            completeTick(now);
            return TickOutcome.IDLE;
        }

        log.info("Found {} due work items", dueItems.size());
        ensureNotCancelled();

        var jobs = dueItems.stream().map(JobDescriptor::scheduled).toList();
        var dispatchIds = jobDispatcher.enqueueBatch(jobs);
        metricsConfig.recordDispatched(ScheduleType.SCHEDULED, dispatchIds.size());

        // Once dispatched the items must be advanced, so no cancellation point below
        advanceSchedules(dueItems, now);

        log.info("Scheduler tick completed (enqueued: {}, updated: {})", dispatchIds.size(), dueItems.size());
        completeTick(now);
        return TickOutcome.COMPLETED;
    }

    /**
     * Persist nextRun = now + interval and lastRunAt = now for every dispatched item.
     * Updates are independent; a failure leaves the others applied.
     */
    private void advanceSchedules(List<WorkItem> dispatched, Instant now) {
        var futures = dispatched.stream()
                .map(item -> CompletableFuture.runAsync(
                        () -> workStore.updateItem(item.getId(), item.getOwnerId(),
                                new SchedulePatch(item.getSchedule().nextRunAfter(now), now)),
                        updateExecutor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void completeTick(Instant now) {
        consecutiveErrorCount.set(0);
        metricsConfig.setConsecutiveErrors(0);
        lastTickTime = now;
        lastError = null;
        leaseLock.renew();
    }

    private void recordFailure(Throwable e) {
        var count = consecutiveErrorCount.incrementAndGet();
        metricsConfig.setConsecutiveErrors(count);
        lastError = e.getMessage();

        log.error("Scheduler tick error ({}/{} consecutive): {}", count, properties.getMaxConsecutiveErrors(), e.getMessage(), e);

        if (count >= properties.getMaxConsecutiveErrors()) {
            disable(count, e);
        }
    }

    private void disable(int count, Throwable cause) {
        if (!phase.compareAndSet(SchedulerPhase.RUNNING, SchedulerPhase.DISABLED)) {
            return;
        }

        log.error("Scheduler disabled after {} consecutive tick errors; restart required", count);
        stopSignal.countDown();
        leaseLock.release();
        metricsConfig.recordDisabled();
        slackAlertService.sendSchedulerDisabledAlert(leaseLock.getInstanceId(), count, cause.getMessage());
    }

    private void ensureNotCancelled() {
        if (phase.get() != SchedulerPhase.RUNNING || Thread.currentThread().isInterrupted()) {
            throw new TickCancelledException();
        }
    }

    // === Manual trigger ===

    /**
     * Dispatch one "manual" job for an item, bypassing the lease and the loop.
     * Does not touch the item's schedule.
     *
     * @return the dispatch id
     * @throws WorkItemNotFoundException if the item does not exist or belongs to another owner
     */
    public String triggerManualRun(UUID itemId, String ownerId) {
        try {
            var item = workStore.getItem(itemId, ownerId)
                    .orElseThrow(() -> new WorkItemNotFoundException(itemId, ownerId));

            // Reopens a producer closed by stop() and leaves it open; no-op when already open
            jobDispatcher.initialize();

            var dispatchId = jobDispatcher.enqueueOne(JobDescriptor.manual(item.getId(), ownerId));
            metricsConfig.recordDispatched(ScheduleType.MANUAL, 1);

            log.info("Manual run triggered for item {} (owner {}): {}", itemId, ownerId, dispatchId);
            return dispatchId;
        } catch (RuntimeException e) {
            log.error("Failed to trigger manual run for item {} (owner {}): {}", itemId, ownerId, e.getMessage());
            throw e;
        }
    }

    // === Status ===

    public SchedulerStatus status() {
        return SchedulerStatus.builder()
                .phase(phase.get())
                .running(isRunning())
                .enabled(properties.isEnabled())
                .instanceId(leaseLock.getInstanceId())
                .lastTickTime(lastTickTime)
                .consecutiveErrorCount(consecutiveErrorCount.get())
                .maxConsecutiveErrors(properties.getMaxConsecutiveErrors())
                .pollInterval(properties.getPollInterval().toString())
                .lastError(lastError)
                .dispatcherOpen(jobDispatcher.isOpen())
                .lease(leaseLock.status())
                .build();
    }

    public boolean isRunning() {
        return phase.get() == SchedulerPhase.RUNNING;
    }

    public SchedulerPhase getPhase() {
        return phase.get();
    }

    public int getConsecutiveErrorCount() {
        return consecutiveErrorCount.get();
    }

    public Instant getLastTickTime() {
        return lastTickTime;
    }

    private static final class TickCancelledException extends RuntimeException {
        TickCancelledException() {
            super("Tick cancelled", null, false, false);
        }
    }
}
