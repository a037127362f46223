package com.example.workscheduler.store;

import com.example.workscheduler.domain.entity.SchedulerLease;
import com.example.workscheduler.domain.repository.SchedulerLeaseRepository;
import com.example.workscheduler.exception.LeaseConflictException;
import com.example.workscheduler.exception.LockStoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.Optional;

/**
 * Lock store backed by the {@code scheduler_lease} table.
 * <p>
 * Writes are conditional on the JPA version column: an insert fails if the
 * row already exists and an update fails if the row changed since it was
 * read. Both surface as {@link LeaseConflictException}.
 */
@Slf4j
@Component
public class JpaLockStore implements LockStore {

    private final SchedulerLeaseRepository leaseRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaLockStore(SchedulerLeaseRepository leaseRepository, PlatformTransactionManager transactionManager) {
        this.leaseRepository = leaseRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<LeaseRecord> read(String leaseKey, String partitionKey) {
        try {
            return leaseRepository.findByLeaseKeyAndPartitionKey(leaseKey, partitionKey).map(this::toRecord);
        } catch (DataAccessException | TransactionException e) {
            throw new LockStoreUnavailableException(leaseKey, e);
        }
    }

    @Override
    public void upsert(LeaseRecord record) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (record.version() == null) {
                    insert(record);
                } else {
                    update(record);
                }
            });
        } catch (LeaseConflictException e) {
            throw e;
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new LeaseConflictException(record.leaseKey(), record.version(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new LockStoreUnavailableException(record.leaseKey(), e);
        }
    }

    @Override
    public boolean delete(String leaseKey, String partitionKey, Long expectedVersion) {
        try {
            var deleted = transactionTemplate.execute(status -> leaseRepository.deleteIfVersionMatches(leaseKey, partitionKey, expectedVersion));
            return deleted != null && deleted > 0;
        } catch (DataAccessException | TransactionException e) {
            throw new LockStoreUnavailableException(leaseKey, e);
        }
    }

    private void insert(LeaseRecord record) {
        if (leaseRepository.existsById(record.leaseKey())) {
            throw new LeaseConflictException(record.leaseKey(), null);
        }

        var lease = SchedulerLease.builder()
                .leaseKey(record.leaseKey())
                .partitionKey(record.partitionKey())
                .leaseHolder(record.leaseHolder())
                .leaseExpiresAt(record.leaseExpiresAt())
                .lastRenewed(record.lastRenewed())
                .createdAt(record.createdAt())
                .build();

        leaseRepository.saveAndFlush(lease);
    }

    private void update(LeaseRecord record) {
        var lease = leaseRepository.findByLeaseKeyAndPartitionKey(record.leaseKey(), record.partitionKey())
                .orElseThrow(() -> new LeaseConflictException(record.leaseKey(), record.version()));

        if (!Objects.equals(lease.getVersion(), record.version())) {
            throw new LeaseConflictException(record.leaseKey(), record.version());
        }

        lease.setLeaseHolder(record.leaseHolder());
        lease.setLeaseExpiresAt(record.leaseExpiresAt());
        lease.setLastRenewed(record.lastRenewed());
        lease.setCreatedAt(record.createdAt());

        // flush issues UPDATE ... WHERE version = ?
        leaseRepository.saveAndFlush(lease);
    }

    private LeaseRecord toRecord(SchedulerLease lease) {
        return new LeaseRecord(
                lease.getLeaseKey(),
                lease.getPartitionKey(),
                lease.getLeaseHolder(),
                lease.getLeaseExpiresAt(),
                lease.getLastRenewed(),
                lease.getCreatedAt(),
                lease.getVersion());
    }
}
