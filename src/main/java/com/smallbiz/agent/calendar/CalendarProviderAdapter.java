package com.smallbiz.agent.calendar;

import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.ProviderSyncException;

/**
 * Uniform sync contract implemented once per {@link CalendarProvider}.
 */
public interface CalendarProviderAdapter {

    CalendarProvider provider();

    boolean isConnected(Long businessId);

    /**
     * Creates or updates the provider's copy of the appointment.
     *
     * @return the provider event id, or null when the business has no usable credentials
     * @throws ProviderSyncException when the provider rejects or cannot be reached
     */
    String syncAppointment(Long businessId, Appointment appointment);

    /**
     * Removes a previously synced event. Removing an event the provider no longer has counts as success.
     */
    boolean deleteAppointment(Long businessId, String eventId);
}
