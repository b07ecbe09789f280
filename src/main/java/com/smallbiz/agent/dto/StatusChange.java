package com.smallbiz.agent.dto;

import com.smallbiz.agent.entity.Appointment;
import jakarta.validation.constraints.NotNull;

public record StatusChange(@NotNull Appointment.Status status) {
}
