package com.example.workscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a single scheduler tick, used for metrics and logging.
 */
@Getter
@RequiredArgsConstructor
public enum TickOutcome {

    /** Due items were dispatched and advanced */
    COMPLETED("completed"),

    /** Lease held but nothing was due */
    IDLE("idle"),

    /** Another instance holds the lease, or the loop is not running */
    SKIPPED("skipped"),

    /** Stop was requested while the tick was in progress */
    CANCELLED("cancelled"),

    /** The tick threw and was counted toward the error threshold */
    FAILED("failed");

    private final String code;
}
