package com.example.workscheduler.service.lock;

import com.example.workscheduler.config.MetricsConfig;
import com.example.workscheduler.config.WorkSchedulerProperties;
import com.example.workscheduler.dto.LeaseStatus;
import com.example.workscheduler.exception.LeaseConflictException;
import com.example.workscheduler.store.LeaseRecord;
import com.example.workscheduler.store.LockStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cross-instance mutual exclusion backed by a single lease record.
 * <p>
 * Only the instance holding an unexpired lease dispatches scheduled work.
 * All operations are best-effort and never throw on store errors:
 * <ul>
 *   <li>acquire() grants the lease when the store cannot be read, if
 *       {@code fail-open-on-lock-store-outage} is set</li>
 *   <li>a failed or conflicting write during acquire() means "not acquired"</li>
 *   <li>renew() and release() give up local ownership on any doubt</li>
 * </ul>
 */
@Slf4j
@Component
public class LeaseLock {

    private final LockStore lockStore;
    private final InstanceIdentity instanceIdentity;
    private final WorkSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean held = new AtomicBoolean(false);

    public LeaseLock(LockStore lockStore, InstanceIdentity instanceIdentity, WorkSchedulerProperties properties,
                     MetricsConfig metricsConfig, Clock clock) {
        this.lockStore = lockStore;
        this.instanceIdentity = instanceIdentity;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public void initialize() {
        log.info("Lease lock initialized (instance: {}, lease: {}/{}, duration: {}s, failOpen: {})",
                getInstanceId(), properties.getLeaseKey(), properties.getLeasePartition(),
                properties.getLeaseDurationSeconds(), properties.isFailOpenOnLockStoreOutage());
    }

    /**
     * Try to become, or confirm being, the lease holder.
     *
     * @return true if this instance may schedule for the coming window
     */
    public boolean acquire() {
        var now = clock.instant();

        Optional<LeaseRecord> current;
        try {
            current = lockStore.read(properties.getLeaseKey(), properties.getLeasePartition());
        } catch (RuntimeException e) {
            if (properties.isFailOpenOnLockStoreOutage()) {
                log.error("Lock store unavailable, scheduling without lease (fail-open): {}", e.getMessage());
                return true;
            }
            log.error("Lock store unavailable, not scheduling (fail-closed): {}", e.getMessage());
            setHeld(false);
            return false;
        }

        if (current.isPresent() && !current.get().isExpired(now)) {
            var lease = current.get();
            if (lease.isHeldBy(getInstanceId())) {
                log.debug("Lease already held by this instance {}", getInstanceId());
                setHeld(true);
                return true;
            }

            log.debug("Lease held by {} until {}", lease.leaseHolder(), lease.leaseExpiresAt());
            setHeld(false);
            return false;
        }

        var expiresAt = now.plus(properties.getLeaseDuration());
        var claim = LeaseRecord.claim(properties.getLeaseKey(), properties.getLeasePartition(), getInstanceId(), now, expiresAt, current.orElse(null));

        try {
            lockStore.upsert(claim);
        } catch (LeaseConflictException e) {
            log.info("Lost lease acquisition race: {}", e.getMessage());
            setHeld(false);
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to acquire lease for {}: {}", getInstanceId(), e.getMessage());
            setHeld(false);
            return false;
        }

        log.info("Scheduler lease acquired by {} until {}", getInstanceId(), expiresAt);
        setHeld(true);
        return true;
    }

    /**
     * Extend the lease if this instance still holds it. Never recreates a missing record.
     */
    public void renew() {
        if (!held.get()) {
            return;
        }

        var now = clock.instant();
        try {
            var current = lockStore.read(properties.getLeaseKey(), properties.getLeasePartition());
            if (current.isEmpty()) {
                log.warn("Lease record disappeared, giving up lease for {}", getInstanceId());
                setHeld(false);
                return;
            }

            var lease = current.get();
            if (!lease.isHeldBy(getInstanceId())) {
                log.warn("Lost scheduler lease to {} (was {})", lease.leaseHolder(), getInstanceId());
                setHeld(false);
                return;
            }

            var expiresAt = now.plus(properties.getLeaseDuration());
            lockStore.upsert(lease.renewed(now, expiresAt));
            log.debug("Scheduler lease renewed by {} until {}", getInstanceId(), expiresAt);
        } catch (LeaseConflictException e) {
            log.warn("Lease changed during renewal, giving it up: {}", e.getMessage());
            setHeld(false);
        } catch (RuntimeException e) {
            log.warn("Failed to renew lease: {}", e.getMessage());
            setHeld(false);
        }
    }

    /**
     * Delete the lease record if this instance still holds it.
     */
    public void release() {
        if (!held.get()) {
            return;
        }

        try {
            var current = lockStore.read(properties.getLeaseKey(), properties.getLeasePartition());
            if (current.isPresent() && current.get().isHeldBy(getInstanceId())) {
                var lease = current.get();
                if (lockStore.delete(lease.leaseKey(), lease.partitionKey(), lease.version())) {
                    log.info("Scheduler lease released by {}", getInstanceId());
                } else {
                    log.warn("Lease changed before it could be released by {}", getInstanceId());
                }
            } else {
                log.info("Lease already reclaimed by another instance, nothing to release");
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release lease: {}", e.getMessage());
        } finally {
            setHeld(false);
        }
    }

    public LeaseStatus status() {
        try {
            var current = lockStore.read(properties.getLeaseKey(), properties.getLeasePartition());
            if (current.isEmpty()) {
                return LeaseStatus.builder()
                        .status(LeaseStatus.AVAILABLE)
                        .instanceId(getInstanceId())
                        .heldLocally(held.get())
                        .reason("No active lease")
                        .build();
            }

            var lease = current.get();
            return LeaseStatus.builder()
                    .status(LeaseStatus.ACTIVE)
                    .instanceId(getInstanceId())
                    .leaseHolder(lease.leaseHolder())
                    .ourLease(lease.isHeldBy(getInstanceId()))
                    .heldLocally(held.get())
                    .leaseExpiresAt(lease.leaseExpiresAt())
                    .secondsUntilExpiry(Duration.between(clock.instant(), lease.leaseExpiresAt()).toSeconds())
                    .lastRenewed(lease.lastRenewed())
                    .build();
        } catch (RuntimeException e) {
            return LeaseStatus.builder()
                    .status(LeaseStatus.UNKNOWN)
                    .instanceId(getInstanceId())
                    .heldLocally(held.get())
                    .reason(e.getMessage())
                    .build();
        }
    }

    /**
     * Whether this instance currently believes it holds the lease
     */
    public boolean isHeld() {
        return held.get();
    }

    public String getInstanceId() {
        return instanceIdentity.getInstanceId();
    }

    private void setHeld(boolean value) {
        held.set(value);
        metricsConfig.setLeaseHeld(value);
    }
}
