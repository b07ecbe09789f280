package com.smallbiz.agent.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * JSON body for creating an appointment over HTTP.
 */
public record AppointmentForm(
        @NotNull Long businessId,
        @NotNull Long customerId,
        Long staffId,
        Long serviceId,
        @NotNull LocalDateTime startTime,
        @NotNull LocalDateTime endTime,
        String notes
) {

    public BookingRequest toBookingRequest() {
        return new BookingRequest(businessId, customerId, staffId, serviceId, startTime, endTime, notes);
    }
}
