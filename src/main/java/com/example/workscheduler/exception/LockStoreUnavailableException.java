package com.example.workscheduler.exception;

import lombok.Getter;

/**
 * The lock store could not be reached
 */
@Getter
public class LockStoreUnavailableException extends RuntimeException {

    private final String leaseKey;

    public LockStoreUnavailableException(String leaseKey, Exception cause) {
        super(String.format("Lock store unavailable for lease %s: %s", leaseKey, cause.getMessage()), cause);
        this.leaseKey = leaseKey;
    }
}
