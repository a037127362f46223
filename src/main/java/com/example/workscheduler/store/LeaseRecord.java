package com.example.workscheduler.store;

import java.time.Instant;

/**
 * Snapshot of the lease row as read from the lock store.
 * <p>
 * {@code version} is the concurrency token of the row that was read; it is
 * null for a record that has never been written.
 */
public record LeaseRecord(
        String leaseKey,
        String partitionKey,
        String leaseHolder,
        Instant leaseExpiresAt,
        Instant lastRenewed,
        Instant createdAt,
        Long version
) {

    /**
     * A fresh claim for {@code holder}, replacing {@code previous} if there was one.
     * Keeps the original creation time and the version token of the row being replaced.
     */
    public static LeaseRecord claim(String leaseKey, String partitionKey, String holder, Instant now, Instant expiresAt, LeaseRecord previous) {
        var createdAt = previous != null && previous.createdAt() != null ? previous.createdAt() : now;
        var version = previous != null ? previous.version() : null;
        return new LeaseRecord(leaseKey, partitionKey, holder, expiresAt, now, createdAt, version);
    }

    public LeaseRecord renewed(Instant now, Instant expiresAt) {
        return new LeaseRecord(leaseKey, partitionKey, leaseHolder, expiresAt, now, createdAt, version);
    }

    /**
     * Expired leases are free regardless of who holds them.
     */
    public boolean isExpired(Instant now) {
        return !leaseExpiresAt.isAfter(now);
    }

    public boolean isHeldBy(String instanceId) {
        return leaseHolder != null && leaseHolder.equals(instanceId);
    }
}
