package com.smallbiz.agent.dto;

import java.time.LocalDateTime;

/**
 * Partial appointment collected during a call. Start and end are either both present or ignored.
 */
public record AppointmentDraft(
        LocalDateTime startTime,
        LocalDateTime endTime,
        Long staffId,
        Long serviceId,
        String notes,
        String transcript
) {

    public boolean hasConcreteTime() {
        return startTime != null && endTime != null;
    }
}
