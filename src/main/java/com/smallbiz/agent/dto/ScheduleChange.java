package com.smallbiz.agent.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record ScheduleChange(@NotNull LocalDateTime startTime, @NotNull LocalDateTime endTime) {
}
