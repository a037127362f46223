package com.example.workscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Diagnostic view of the scheduler lease
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaseStatus {

    public static final String ACTIVE = "active";
    public static final String AVAILABLE = "available";
    public static final String UNKNOWN = "unknown";

    /**
     * active, available or unknown
     */
    private String status;

    private String instanceId;
    private String leaseHolder;
    private boolean ourLease;
    private boolean heldLocally;
    private Instant leaseExpiresAt;
    private Long secondsUntilExpiry;
    private Instant lastRenewed;
    private String reason;
}
