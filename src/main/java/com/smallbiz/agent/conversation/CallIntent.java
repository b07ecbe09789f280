package com.smallbiz.agent.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller intents. The first eight are keyword driven and evaluated in declaration order.
 */
public enum CallIntent {
    APPOINTMENT,
    INQUIRY,
    STATUS,
    COMPLAINT,
    PAYMENT,
    LOCATION,
    HOURS,
    SERVICES,
    EMERGENCY,
    GENERAL,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
