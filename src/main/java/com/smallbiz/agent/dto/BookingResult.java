package com.smallbiz.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smallbiz.agent.entity.Appointment;

/**
 * Outcome of a booking attempt. A failed result never carries an appointment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResult(boolean success, Appointment appointment, String error, Failure errorType) {

    public enum Failure { CONFLICT, INVALID, ERROR }

    public static BookingResult success(Appointment appointment) {
        return new BookingResult(true, appointment, null, null);
    }

    public static BookingResult conflict(String msg) {
        return new BookingResult(false, null, msg, Failure.CONFLICT);
    }

    public static BookingResult invalid(String msg) {
        return new BookingResult(false, null, msg, Failure.INVALID);
    }

    public static BookingResult error(String msg) {
        return new BookingResult(false, null, msg, Failure.ERROR);
    }

    public boolean isConflict() {
        return errorType == Failure.CONFLICT;
    }
}
