package com.smallbiz.agent.calendar;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-provider outcome of a sync or delete fan-out. Providers that were not attempted report false.
 */
public final class SyncResult {

    private final Long appointmentId;
    private final Map<CalendarProvider, Boolean> results;

    public SyncResult(Long appointmentId, Map<CalendarProvider, Boolean> results) {
        this.appointmentId = appointmentId;
        EnumMap<CalendarProvider, Boolean> copy = new EnumMap<>(CalendarProvider.class);
        for (CalendarProvider provider : CalendarProvider.values()) {
            copy.put(provider, Boolean.TRUE.equals(results.get(provider)));
        }
        this.results = Collections.unmodifiableMap(copy);
    }

    public Long getAppointmentId() {
        return appointmentId;
    }

    public boolean isSynced() {
        return results.containsValue(Boolean.TRUE);
    }

    public boolean isGoogle() {
        return results.get(CalendarProvider.GOOGLE);
    }

    public boolean isMicrosoft() {
        return results.get(CalendarProvider.MICROSOFT);
    }

    public boolean isApple() {
        return results.get(CalendarProvider.APPLE);
    }

    public boolean succeeded(CalendarProvider provider) {
        return results.get(provider);
    }

    public Map<CalendarProvider, Boolean> results() {
        return results;
    }

    @Override
    public String toString() {
        return "SyncResult{appointmentId=" + appointmentId + ", results=" + results + '}';
    }
}
