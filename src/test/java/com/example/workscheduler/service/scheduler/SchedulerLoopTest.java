package com.example.workscheduler.service.scheduler;

import com.example.workscheduler.config.MetricsConfig;
import com.example.workscheduler.config.WorkSchedulerProperties;
import com.example.workscheduler.domain.entity.WorkItem;
import com.example.workscheduler.domain.entity.WorkSchedule;
import com.example.workscheduler.domain.enums.ScheduleType;
import com.example.workscheduler.domain.enums.SchedulerPhase;
import com.example.workscheduler.domain.enums.TickOutcome;
import com.example.workscheduler.exception.SchedulerInitializationException;
import com.example.workscheduler.exception.WorkItemNotFoundException;
import com.example.workscheduler.service.alert.SlackAlertService;
import com.example.workscheduler.service.lock.InstanceIdentity;
import com.example.workscheduler.service.lock.LeaseLock;
import com.example.workscheduler.store.JobDescriptor;
import com.example.workscheduler.store.JobDispatcher;
import com.example.workscheduler.store.LeaseRecord;
import com.example.workscheduler.store.SchedulePatch;
import com.example.workscheduler.store.WorkStore;
import com.example.workscheduler.support.InMemoryLockStore;
import com.example.workscheduler.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerLoop Tests")
class SchedulerLoopTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final String OWNER = "owner-1";

    @Mock
    private WorkStore workStore;

    @Mock
    private JobDispatcher jobDispatcher;

    @Mock
    private SlackAlertService slackAlertService;

    private InMemoryLockStore lockStore;
    private MutableClock clock;
    private WorkSchedulerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService loopExecutor;
    private ExecutorService updateExecutor;

    private SchedulerLoop schedulerLoop;

    @BeforeEach
    void setUp() {
        lockStore = new InMemoryLockStore();
        clock = new MutableClock(T0);
        properties = new WorkSchedulerProperties();
        meterRegistry = new SimpleMeterRegistry();
        var metricsConfig = new MetricsConfig(meterRegistry);
        metricsConfig.initializeMetrics();

        var leaseLock = new LeaseLock(lockStore, InstanceIdentity.of("instance-a"), properties, metricsConfig, clock);
        loopExecutor = Executors.newSingleThreadExecutor();
        updateExecutor = Executors.newFixedThreadPool(4);

        schedulerLoop = new SchedulerLoop(workStore, jobDispatcher, leaseLock, properties, metricsConfig,
                slackAlertService, clock, loopExecutor, updateExecutor);
    }

    @AfterEach
    void tearDown() {
        schedulerLoop.stop();
        loopExecutor.shutdownNow();
        updateExecutor.shutdownNow();
    }

    private WorkItem dueItem(int intervalHours) {
        return WorkItem.builder()
                .id(UUID.randomUUID())
                .ownerId(OWNER)
                .name("report")
                .schedule(WorkSchedule.builder()
                        .enabled(true)
                        .intervalHours(intervalHours)
                        .nextRun(T0.minus(Duration.ofHours(1)))
                        .build())
                .version(0L)
                .build();
    }

    private void startWithNothingDue() {
        when(workStore.getDueItems(any(Instant.class), eq(50))).thenReturn(List.of());
        schedulerLoop.start();
    }

    private Optional<LeaseRecord> lease() {
        return lockStore.read(properties.getLeaseKey(), properties.getLeasePartition());
    }

    private void awaitPhase(SchedulerPhase expected) throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (schedulerLoop.getPhase() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(schedulerLoop.getPhase()).isEqualTo(expected);
    }

    private double ticksWithOutcome(TickOutcome outcome) {
        return meterRegistry.counter("work_scheduler_ticks", "outcome", outcome.getCode()).count();
    }

    @Nested
    @DisplayName("start Tests")
    class StartTests {

        @Test
        @DisplayName("Should initialize dependencies, take the lease and run a first tick")
        void shouldStartAndRunFirstTick() {
            // When
            startWithNothingDue();

            // Then
            verify(workStore).initialize();
            verify(jobDispatcher).initialize();
            verify(workStore).getDueItems(T0, 50);
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            assertThat(schedulerLoop.isRunning()).isTrue();
            assertThat(schedulerLoop.getLastTickTime()).isEqualTo(T0);
            assertThat(lease()).get().extracting(LeaseRecord::leaseHolder).isEqualTo("instance-a");
        }

        @Test
        @DisplayName("Should not start when disabled by configuration")
        void shouldNotStartWhenDisabled() {
            // Given
            properties.setEnabled(false);

            // When
            schedulerLoop.start();

            // Then
            verifyNoInteractions(workStore, jobDispatcher);
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
        }

        @Test
        @DisplayName("Should propagate initialization failure and stay stopped")
        void shouldPropagateInitializationFailure() {
            // Given
            doThrow(new SchedulerInitializationException("job queue", "connection refused"))
                    .when(jobDispatcher).initialize();

            // When / Then
            assertThatThrownBy(() -> schedulerLoop.start())
                    .isInstanceOf(SchedulerInitializationException.class)
                    .hasMessageContaining("connection refused");
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
            verify(workStore, never()).getDueItems(any(), anyInt());
        }

        @Test
        @DisplayName("Should refuse a lease shorter than the poll interval")
        void shouldRejectLeaseShorterThanPollInterval() {
            // Given
            properties.setLeaseDurationSeconds(300);

            // When / Then
            assertThatThrownBy(() -> schedulerLoop.start())
                    .isInstanceOf(SchedulerInitializationException.class)
                    .hasMessageContaining("must exceed poll interval");
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
        }

        @Test
        @DisplayName("Should refuse a non-positive poll interval")
        void shouldRejectZeroPollInterval() {
            // Given
            properties.setPollInterval(Duration.ZERO);

            // When / Then
            assertThatThrownBy(() -> schedulerLoop.start())
                    .isInstanceOf(SchedulerInitializationException.class)
                    .hasMessageContaining("poll interval must be positive");
            verifyNoInteractions(workStore, jobDispatcher);
        }

        @Test
        @DisplayName("Should ignore a second start while running")
        void shouldIgnoreSecondStart() {
            // Given
            startWithNothingDue();

            // When
            schedulerLoop.start();

            // Then
            verify(workStore, times(1)).initialize();
        }
    }

    @Nested
    @DisplayName("tick Tests")
    class TickTests {

        @Test
        @DisplayName("Should dispatch due items and advance their next run")
        void shouldDispatchDueItems() {
            // Given
            startWithNothingDue();
            var items = List.of(dueItem(6), dueItem(6), dueItem(6));
            when(workStore.getDueItems(T0, 50)).thenReturn(items);
            when(jobDispatcher.enqueueBatch(anyList())).thenReturn(List.of("d-1", "d-2", "d-3"));

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.COMPLETED);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<JobDescriptor>> jobs = ArgumentCaptor.forClass(List.class);
            verify(jobDispatcher).enqueueBatch(jobs.capture());
            assertThat(jobs.getValue()).hasSize(3)
                    .allSatisfy(job -> assertThat(job.scheduleType()).isEqualTo(ScheduleType.SCHEDULED))
                    .extracting(JobDescriptor::itemId)
                    .containsExactly(items.get(0).getId(), items.get(1).getId(), items.get(2).getId());

            var expectedPatch = new SchedulePatch(T0.plus(Duration.ofHours(6)), T0);
            for (var item : items) {
                verify(workStore).updateItem(item.getId(), OWNER, expectedPatch);
            }
            assertThat(meterRegistry.counter("work_scheduler_jobs_dispatched", "schedule_type", "scheduled").count())
                    .isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should complete an idle tick and renew the lease")
        void shouldRenewLeaseOnIdleTick() {
            // Given
            startWithNothingDue();
            clock.advance(Duration.ofMinutes(5));

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.IDLE);
            verify(jobDispatcher, never()).enqueueBatch(anyList());
            verify(workStore, never()).updateItem(any(), any(), any());
            assertThat(schedulerLoop.getLastTickTime()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
            assertThat(lease()).get().extracting(LeaseRecord::leaseExpiresAt)
                    .isEqualTo(T0.plus(Duration.ofMinutes(5)).plusSeconds(360));
        }

        @Test
        @DisplayName("Should skip the tick without querying when another instance holds the lease")
        void shouldSkipWhenLeaseHeldElsewhere() {
            // Given
            lockStore.put(new LeaseRecord(properties.getLeaseKey(), properties.getLeasePartition(),
                    "instance-b", T0.plusSeconds(200), T0, T0, 0L));

            // When
            schedulerLoop.start();
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.SKIPPED);
            verify(workStore, never()).getDueItems(any(), anyInt());
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isZero();
        }

        @Test
        @DisplayName("Should reset the error counter after a successful tick")
        void shouldResetErrorCounter() {
            // Given
            startWithNothingDue();
            doThrow(new RuntimeException("store down")).when(workStore).getDueItems(any(), anyInt());
            schedulerLoop.tick();
            schedulerLoop.tick();
            schedulerLoop.tick();
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isEqualTo(3);
            assertThat(schedulerLoop.status().getLastError()).isEqualTo("store down");

            doReturn(List.of()).when(workStore).getDueItems(any(), anyInt());

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.IDLE);
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isZero();
            assertThat(schedulerLoop.status().getLastError()).isNull();
        }

        @Test
        @DisplayName("Should count an Error thrown by the store as a tick error")
        void shouldCountErrorFromStore() {
            // Given
            startWithNothingDue();
            doThrow(new NoClassDefFoundError("org/postgresql/Driver")).when(workStore).getDueItems(any(), anyInt());

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.FAILED);
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isEqualTo(1);
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            assertThat(schedulerLoop.status().getLastError()).isEqualTo("org/postgresql/Driver");
        }

        @Test
        @DisplayName("Should count a failed next-run update as a tick error")
        void shouldCountUpdateFailure() {
            // Given
            startWithNothingDue();
            var ok = dueItem(6);
            var broken = dueItem(6);
            when(workStore.getDueItems(T0, 50)).thenReturn(List.of(ok, broken));
            when(jobDispatcher.enqueueBatch(anyList())).thenReturn(List.of("d-1", "d-2"));
            when(workStore.updateItem(any(), eq(OWNER), any())).thenAnswer(invocation -> {
                if (broken.getId().equals(invocation.getArgument(0))) {
                    throw new IllegalStateException("row locked");
                }
                return ok;
            });

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.FAILED);
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isEqualTo(1);
            verify(workStore).updateItem(eq(ok.getId()), eq(OWNER), any());
        }

        @Test
        @DisplayName("Should treat a non-positive interval as a tick error")
        void shouldFailOnNonPositiveInterval() {
            // Given
            startWithNothingDue();
            when(workStore.getDueItems(T0, 50)).thenReturn(List.of(dueItem(0)));
            when(jobDispatcher.enqueueBatch(anyList())).thenReturn(List.of("d-1"));

            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.FAILED);
            verify(workStore, never()).updateItem(any(), any(), any());
        }

        @Test
        @DisplayName("Should skip ticks when not running")
        void shouldSkipWhenStopped() {
            // When
            var outcome = schedulerLoop.tick();

            // Then
            assertThat(outcome).isEqualTo(TickOutcome.SKIPPED);
            verifyNoInteractions(workStore, jobDispatcher);
            assertThat(lease()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Self-disable Tests")
    class SelfDisableTests {

        @Test
        @DisplayName("Should disable itself after ten consecutive errors")
        void shouldDisableAfterMaxErrors() {
            // Given
            startWithNothingDue();
            doThrow(new RuntimeException("store down")).when(workStore).getDueItems(any(), anyInt());

            // When
            for (var i = 0; i < 9; i++) {
                assertThat(schedulerLoop.tick()).isEqualTo(TickOutcome.FAILED);
                assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            }
            var tenth = schedulerLoop.tick();

            // Then
            assertThat(tenth).isEqualTo(TickOutcome.FAILED);
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.DISABLED);
            assertThat(schedulerLoop.isRunning()).isFalse();
            assertThat(lease()).isEmpty();
            verify(slackAlertService).sendSchedulerDisabledAlert("instance-a", 10, "store down");
            assertThat(meterRegistry.counter("work_scheduler_disabled").count()).isEqualTo(1.0);

            assertThat(schedulerLoop.tick()).isEqualTo(TickOutcome.SKIPPED);
        }

        @Test
        @DisplayName("Should restart after being disabled")
        void shouldRestartAfterDisable() {
            // Given
            properties.setMaxConsecutiveErrors(2);
            startWithNothingDue();
            doThrow(new RuntimeException("store down")).when(workStore).getDueItems(any(), anyInt());
            schedulerLoop.tick();
            schedulerLoop.tick();
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.DISABLED);

            doReturn(List.of()).when(workStore).getDueItems(any(), anyInt());

            // When
            schedulerLoop.start();

            // Then
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isZero();
            assertThat(lease()).isPresent();
        }

        @Test
        @DisplayName("Should move from disabled to stopped on stop")
        void shouldStopFromDisabled() {
            // Given
            properties.setMaxConsecutiveErrors(1);
            startWithNothingDue();
            doThrow(new RuntimeException("store down")).when(workStore).getDueItems(any(), anyInt());
            schedulerLoop.tick();

            // When
            schedulerLoop.stop();

            // Then
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
            verify(jobDispatcher).close();
        }
    }

    @Nested
    @DisplayName("stop Tests")
    class StopTests {

        @Test
        @DisplayName("Should release the lease and close the queue producer")
        void shouldReleaseLeaseOnStop() {
            // Given
            startWithNothingDue();
            assertThat(lease()).isPresent();

            // When
            schedulerLoop.stop();

            // Then
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
            assertThat(lease()).isEmpty();
            verify(jobDispatcher).close();
        }

        @Test
        @DisplayName("Should be a no-op when already stopped")
        void shouldIgnoreStopWhenStopped() {
            // When
            schedulerLoop.stop();

            // Then
            verify(jobDispatcher, never()).close();
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
        }
    }

    @Nested
    @DisplayName("triggerManualRun Tests")
    class TriggerManualRunTests {

        @Test
        @DisplayName("Should enqueue a manual job without touching the schedule")
        void shouldEnqueueManualJob() {
            // Given
            var item = dueItem(6);
            when(workStore.getItem(item.getId(), OWNER)).thenReturn(Optional.of(item));
            when(jobDispatcher.enqueueOne(any())).thenReturn("d-42");

            // When
            var dispatchId = schedulerLoop.triggerManualRun(item.getId(), OWNER);

            // Then
            assertThat(dispatchId).isEqualTo("d-42");
            verify(jobDispatcher).enqueueOne(new JobDescriptor(item.getId(), OWNER, ScheduleType.MANUAL));
            verify(workStore, never()).updateItem(any(), any(), any());
            assertThat(lease()).isEmpty();
        }

        @Test
        @DisplayName("Should throw not found for an unknown item")
        void shouldRejectUnknownItem() {
            // Given
            var itemId = UUID.randomUUID();
            when(workStore.getItem(itemId, OWNER)).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> schedulerLoop.triggerManualRun(itemId, OWNER))
                    .isInstanceOf(WorkItemNotFoundException.class)
                    .hasMessageContaining(itemId.toString());
            verify(jobDispatcher, never()).enqueueOne(any());
        }

        @Test
        @DisplayName("Should open the queue producer before enqueueing after a stop")
        void shouldOpenDispatcherAfterStop() {
            // Given
            startWithNothingDue();
            schedulerLoop.stop();
            var item = dueItem(6);
            when(workStore.getItem(item.getId(), OWNER)).thenReturn(Optional.of(item));
            when(jobDispatcher.enqueueOne(any())).thenReturn("d-7");

            // When
            schedulerLoop.triggerManualRun(item.getId(), OWNER);

            // Then
            InOrder inOrder = inOrder(jobDispatcher);
            inOrder.verify(jobDispatcher).close();
            inOrder.verify(jobDispatcher).initialize();
            inOrder.verify(jobDispatcher).enqueueOne(any());
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
        }

        @Test
        @DisplayName("Should work while the lease is held by another instance")
        void shouldIgnoreLease() {
            // Given
            lockStore.put(new LeaseRecord(properties.getLeaseKey(), properties.getLeasePartition(),
                    "instance-b", T0.plusSeconds(200), T0, T0, 0L));
            var item = dueItem(6);
            when(workStore.getItem(item.getId(), OWNER)).thenReturn(Optional.of(item));
            when(jobDispatcher.enqueueOne(any())).thenReturn("d-8");

            // When
            var dispatchId = schedulerLoop.triggerManualRun(item.getId(), OWNER);

            // Then
            assertThat(dispatchId).isEqualTo("d-8");
            assertThat(lease()).get().extracting(LeaseRecord::leaseHolder).isEqualTo("instance-b");
        }
    }

    @Nested
    @DisplayName("status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should report phase, last tick and lease")
        void shouldReportStatus() {
            // Given
            startWithNothingDue();
            when(jobDispatcher.isOpen()).thenReturn(true);

            // When
            var status = schedulerLoop.status();

            // Then
            assertThat(status.getPhase()).isEqualTo(SchedulerPhase.RUNNING);
            assertThat(status.isRunning()).isTrue();
            assertThat(status.getInstanceId()).isEqualTo("instance-a");
            assertThat(status.getLastTickTime()).isEqualTo(T0);
            assertThat(status.getMaxConsecutiveErrors()).isEqualTo(10);
            assertThat(status.getLease().isOurLease()).isTrue();
            assertThat(status.getPollInterval()).isEqualTo("PT5M");
            assertThat(status.isDispatcherOpen()).isTrue();
        }
    }

    @Nested
    @DisplayName("Loop thread Tests")
    class LoopThreadTests {

        @Test
        @DisplayName("Should keep ticking every poll interval until stopped")
        void shouldTickRepeatedly() {
            // Given
            properties.setPollInterval(Duration.ofMillis(20));

            // When
            startWithNothingDue();

            // Then
            verify(workStore, timeout(5000).atLeast(4)).getDueItems(any(Instant.class), eq(50));
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.RUNNING);

            schedulerLoop.stop();
            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
            assertThat(lease()).isEmpty();
        }

        @Test
        @DisplayName("Should wait for an in-flight tick, cancel it, then release the lease")
        void shouldCancelInFlightTickOnStop() throws Exception {
            // Given
            properties.setPollInterval(Duration.ofMillis(20));
            var tickEntered = new CountDownLatch(1);
            var releaseTick = new CountDownLatch(1);
            when(workStore.getDueItems(any(Instant.class), eq(50)))
                    .thenReturn(List.of())
                    .thenAnswer(invocation -> {
                        tickEntered.countDown();
                        releaseTick.await(5, TimeUnit.SECONDS);
                        return List.of(dueItem(6));
                    });
            schedulerLoop.start();
            assertThat(tickEntered.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            var stopper = CompletableFuture.runAsync(schedulerLoop::stop);
            awaitPhase(SchedulerPhase.STOPPING);

            // Then
            assertThat(stopper).isNotDone();
            assertThat(lease()).isPresent();

            releaseTick.countDown();
            stopper.get(5, TimeUnit.SECONDS);

            assertThat(schedulerLoop.getPhase()).isEqualTo(SchedulerPhase.STOPPED);
            assertThat(lease()).isEmpty();
            assertThat(ticksWithOutcome(TickOutcome.CANCELLED)).isEqualTo(1.0);
            verify(jobDispatcher, never()).enqueueBatch(anyList());
            verify(workStore, never()).updateItem(any(), any(), any());
        }

        @Test
        @DisplayName("Should disable itself when the loop thread keeps hitting Errors")
        void shouldDisableOnRepeatedErrors() throws Exception {
            // Given
            properties.setPollInterval(Duration.ofMillis(20));
            properties.setMaxConsecutiveErrors(3);
            when(workStore.getDueItems(any(Instant.class), eq(50)))
                    .thenReturn(List.of())
                    .thenThrow(new ExceptionInInitializerError("driver init failed"));

            // When
            schedulerLoop.start();

            // Then
            verify(slackAlertService, timeout(5000)).sendSchedulerDisabledAlert("instance-a", 3, "driver init failed");
            awaitPhase(SchedulerPhase.DISABLED);
            assertThat(lease()).isEmpty();
            assertThat(schedulerLoop.getConsecutiveErrorCount()).isEqualTo(3);
        }
    }
}
