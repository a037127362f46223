package com.example.workscheduler.exception;

import lombok.Getter;

/**
 * A conditional lease write lost against a concurrent writer
 */
@Getter
public class LeaseConflictException extends RuntimeException {

    private final String leaseKey;
    private final Long expectedVersion;

    public LeaseConflictException(String leaseKey, Long expectedVersion) {
        super(String.format("Lease %s changed since it was read (expected version %s)", leaseKey, expectedVersion));
        this.leaseKey = leaseKey;
        this.expectedVersion = expectedVersion;
    }

    public LeaseConflictException(String leaseKey, Long expectedVersion, Exception cause) {
        super(String.format("Lease %s changed since it was read (expected version %s)", leaseKey, expectedVersion), cause);
        this.leaseKey = leaseKey;
        this.expectedVersion = expectedVersion;
    }
}
