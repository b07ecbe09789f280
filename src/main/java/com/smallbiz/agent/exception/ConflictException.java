package com.smallbiz.agent.exception;

import com.smallbiz.agent.dto.AvailableSlot;

import java.util.List;

/**
 * Requested slot overlaps an active appointment. Carries same-day alternatives when known.
 */
public class ConflictException extends SchedulingException {

    private final List<AvailableSlot> alternatives;

    public ConflictException(String message) {
        this(message, List.of());
    }

    public ConflictException(String message, List<AvailableSlot> alternatives) {
        super(message);
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public List<AvailableSlot> getAlternatives() {
        return alternatives;
    }
}
