package com.example.workscheduler.domain.repository;

import com.example.workscheduler.domain.entity.SchedulerLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the scheduler lease row.
 */
@Repository
public interface SchedulerLeaseRepository extends JpaRepository<SchedulerLease, String> {

    Optional<SchedulerLease> findByLeaseKeyAndPartitionKey(String leaseKey, String partitionKey);

    /**
     * Delete the lease only if it is still at the version the caller read.
     *
     * @return number of rows deleted (1 if successful, 0 if the row changed or is gone)
     */
    @Modifying
    @Query("""
            DELETE FROM SchedulerLease l
            WHERE l.leaseKey = :leaseKey
              AND l.partitionKey = :partitionKey
              AND l.version = :version
            """)
    int deleteIfVersionMatches(
            @Param("leaseKey") String leaseKey,
            @Param("partitionKey") String partitionKey,
            @Param("version") Long version);
}
