package com.example.workscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of the scheduler loop within one process.
 * <p>
 * STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED, plus DISABLED which
 * is entered from RUNNING after too many consecutive tick failures and is
 * only left by an explicit start(). Serialized with its lower-case code.
 */
@Getter
@RequiredArgsConstructor
public enum SchedulerPhase {

    STOPPED("stopped", false),
    STARTING("starting", false),
    RUNNING("running", true),
    STOPPING("stopping", false),
    DISABLED("disabled", false);

    @JsonValue
    private final String code;

    /**
     * Whether ticks are allowed to do work in this phase
     */
    private final boolean active;

    /**
     * Phases from which start() may proceed
     */
    public boolean canStart() {
        return this == STOPPED || this == DISABLED;
    }
}
