package com.example.workscheduler.exception;

import lombok.Getter;

/**
 * Raised by start() when a downstream dependency cannot be set up.
 * The loop never enters RUNNING when this is thrown.
 */
@Getter
public class SchedulerInitializationException extends RuntimeException {

    private final String component;

    public SchedulerInitializationException(String component, Exception cause) {
        super(String.format("Failed to initialize %s: %s", component, cause.getMessage()), cause);
        this.component = component;
    }

    public SchedulerInitializationException(String component, String message) {
        super(String.format("Failed to initialize %s: %s", component, message));
        this.component = component;
    }
}
