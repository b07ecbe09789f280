package com.smallbiz.agent.dto;

import java.time.LocalDateTime;

/**
 * A candidate interval produced by the availability walk, flagged bookable or not.
 */
public record AvailableSlot(LocalDateTime start, LocalDateTime end, boolean available) {
}
