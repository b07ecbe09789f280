package com.smallbiz.agent.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * Appointment request captured by the receptionist. Times are optional; without them open slots are listed.
 */
public record AppointmentRequestForm(
        @NotNull Long businessId,
        @NotNull Long customerId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Long staffId,
        Long serviceId,
        String notes,
        String transcript
) {

    public AppointmentDraft toDraft() {
        return new AppointmentDraft(startTime, endTime, staffId, serviceId, notes, transcript);
    }
}
