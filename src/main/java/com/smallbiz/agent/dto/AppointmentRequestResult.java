package com.smallbiz.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentRequestResult(
        boolean success,
        Long appointmentId,
        String message,
        List<AvailableSlot> timeSlots,
        String error
) {

    public static AppointmentRequestResult booked(Long appointmentId, String message) {
        return new AppointmentRequestResult(true, appointmentId, message, null, null);
    }

    public static AppointmentRequestResult alternatives(String message, List<AvailableSlot> slots, String error) {
        return new AppointmentRequestResult(false, null, message, slots, error);
    }

    public static AppointmentRequestResult options(String message, List<AvailableSlot> slots) {
        return new AppointmentRequestResult(false, null, message, slots, null);
    }

    public static AppointmentRequestResult failed(String message, String error) {
        return new AppointmentRequestResult(false, null, message, null, error);
    }
}
