package com.smallbiz.agent.exception;

/**
 * Malformed input. Surfaced to the caller immediately and never retried.
 */
public class ValidationException extends SchedulingException {

    public ValidationException(String message) {
        super(message);
    }
}
