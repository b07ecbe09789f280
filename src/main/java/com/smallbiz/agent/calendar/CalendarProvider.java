package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.annotation.JsonValue;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.ValidationException;

import java.util.Locale;

/**
 * The closed set of external calendars an appointment can be mirrored to.
 * Each provider knows which appointment field holds its event id.
 */
public enum CalendarProvider {
    GOOGLE,
    MICROSOFT,
    APPLE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String eventIdOf(Appointment appointment) {
        switch (this) {
            case GOOGLE:
                return appointment.getGoogleEventId();
            case MICROSOFT:
                return appointment.getMicrosoftEventId();
            case APPLE:
                return appointment.getAppleEventId();
            default:
                throw new IllegalStateException("Unhandled provider " + this);
        }
    }

    public void assignEventId(Appointment appointment, String eventId) {
        switch (this) {
            case GOOGLE:
                appointment.setGoogleEventId(eventId);
                break;
            case MICROSOFT:
                appointment.setMicrosoftEventId(eventId);
                break;
            case APPLE:
                appointment.setAppleEventId(eventId);
                break;
            default:
                throw new IllegalStateException("Unhandled provider " + this);
        }
    }

    public static CalendarProvider fromCode(String code) {
        if (code != null) {
            for (CalendarProvider p : values()) {
                if (p.code().equalsIgnoreCase(code.trim())) {
                    return p;
                }
            }
        }
        throw new ValidationException("Invalid calendar provider: " + code);
    }
}
