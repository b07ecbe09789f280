package com.smallbiz.agent.exception;

/**
 * Base type for failures raised by the scheduling, calendar and triage services.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }

    protected SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
