package com.smallbiz.agent.dto;

import java.time.LocalDateTime;

public record BookingRequest(
        Long businessId,
        Long customerId,
        Long staffId,
        Long serviceId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String notes
) {
}
