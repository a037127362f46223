package com.example.workscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Singleton row recording which instance holds the scheduling privilege.
 * <p>
 * The row is identified by a fixed lease key plus partition. {@code leaseExpiresAt}
 * is authoritative: once it has passed the lease is free regardless of
 * {@code leaseHolder}. The version column turns every write into a
 * compare-and-swap against the row that was read.
 */
@Entity
@Table(name = "scheduler_lease")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulerLease {

    @Id
    @Column(name = "lease_key", nullable = false, length = 100)
    private String leaseKey;

    @Column(name = "partition_key", nullable = false, length = 100)
    private String partitionKey;

    /**
     * Instance id of the current holder
     */
    @Column(name = "lease_holder", nullable = false, length = 100)
    private String leaseHolder;

    @Column(name = "lease_expires_at", nullable = false)
    private Instant leaseExpiresAt;

    // Observability only

    @Column(name = "last_renewed")
    private Instant lastRenewed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;
}
