package com.example.workscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a job came to be dispatched. Serialized with its lower-case code.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleType {

    /**
     * Dispatched by the scheduler loop because the item was due
     */
    SCHEDULED("scheduled"),

    /**
     * Dispatched on user request, outside the loop and the lease
     */
    MANUAL("manual");

    @JsonValue
    private final String code;
}
