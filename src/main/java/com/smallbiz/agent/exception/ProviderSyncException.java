package com.smallbiz.agent.exception;

import com.smallbiz.agent.calendar.CalendarProvider;

/**
 * Failure talking to a single calendar provider. Never fails the booking or sibling providers.
 */
public class ProviderSyncException extends SchedulingException {

    private final CalendarProvider provider;

    public ProviderSyncException(CalendarProvider provider, String message) {
        super(provider.code() + ": " + message);
        this.provider = provider;
    }

    public ProviderSyncException(CalendarProvider provider, String message, Throwable cause) {
        super(provider.code() + ": " + message, cause);
        this.provider = provider;
    }

    public CalendarProvider getProvider() {
        return provider;
    }
}
