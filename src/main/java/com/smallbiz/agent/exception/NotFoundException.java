package com.smallbiz.agent.exception;

public class NotFoundException extends SchedulingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException appointment(Long id) {
        return new NotFoundException("Appointment with ID " + id + " not found");
    }
}
