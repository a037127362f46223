package com.example.workscheduler.exception;

import lombok.Getter;

/**
 * Exception for job queue failures
 */
@Getter
public class JobDispatchException extends RuntimeException {

    private final int jobCount;

    public JobDispatchException(String message, int jobCount) {
        super(message);
        this.jobCount = jobCount;
    }
}
