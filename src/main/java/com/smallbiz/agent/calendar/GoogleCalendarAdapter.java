package com.smallbiz.agent.calendar;

import com.smallbiz.agent.config.BusinessProperties;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google Calendar API v3: events live under {@code /calendars/{calendarId}/events}.
 */
@Component
public class GoogleCalendarAdapter extends RemoteCalendarAdapter {

    public GoogleCalendarAdapter(CalendarProperties calendarProperties,
                                 BusinessProperties businessProperties,
                                 RestTemplateBuilder restTemplateBuilder,
                                 ProviderCredentialService credentials,
                                 CalendarIntegrationRepository integrationRepository) {
        super(calendarProperties.google(), calendarProperties, businessProperties,
                restTemplateBuilder, credentials, integrationRepository);
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.GOOGLE;
    }

    @Override
    protected String eventsUrl() {
        return settings.safeApiBase() + "/calendars/"
                + UriUtils.encodePathSegment(settings.safeCalendarId(), StandardCharsets.UTF_8) + "/events";
    }

    @Override
    protected String eventUrl(String eventId) {
        return eventsUrl() + "/" + UriUtils.encodePathSegment(eventId, StandardCharsets.UTF_8);
    }

    @Override
    protected HttpMethod updateMethod() {
        return HttpMethod.PUT;
    }

    @Override
    protected Map<String, Object> eventPayload(Appointment appointment) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("summary", IcsFeedWriter.summary(appointment));
        event.put("description", description(appointment));
        event.put("start", when(appointment.getStartTime()));
        event.put("end", when(appointment.getEndTime()));
        return event;
    }

    private Map<String, Object> when(LocalDateTime time) {
        Map<String, Object> when = new LinkedHashMap<>();
        when.put("dateTime", time.atZone(zone).toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        when.put("timeZone", zone.getId());
        return when;
    }
}
