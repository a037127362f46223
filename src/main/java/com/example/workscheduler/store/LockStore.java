package com.example.workscheduler.store;

import java.util.Optional;

/**
 * Read/write access to the shared lease record.
 * <p>
 * Every method throws {@link com.example.workscheduler.exception.LockStoreUnavailableException}
 * when the store cannot be reached.
 */
public interface LockStore {

    Optional<LeaseRecord> read(String leaseKey, String partitionKey);

    /**
     * Insert or replace the lease record, conditional on the record's version.
     * A null version means "only if absent"; otherwise the stored row must still
     * carry that version.
     *
     * @throws com.example.workscheduler.exception.LeaseConflictException if the condition does not hold
     */
    void upsert(LeaseRecord record);

    /**
     * Delete the lease record if it still carries {@code expectedVersion}.
     *
     * @return true if a row was deleted
     */
    boolean delete(String leaseKey, String partitionKey, Long expectedVersion);
}
