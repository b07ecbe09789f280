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
 * Microsoft Graph: events of the signed in user under {@code /me/events}; updates are PATCH.
 */
@Component
public class MicrosoftCalendarAdapter extends RemoteCalendarAdapter {

    public MicrosoftCalendarAdapter(CalendarProperties calendarProperties,
                                    BusinessProperties businessProperties,
                                    RestTemplateBuilder restTemplateBuilder,
                                    ProviderCredentialService credentials,
                                    CalendarIntegrationRepository integrationRepository) {
        super(calendarProperties.microsoft(), calendarProperties, businessProperties,
                restTemplateBuilder, credentials, integrationRepository);
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.MICROSOFT;
    }

    @Override
    protected String eventsUrl() {
        return settings.safeApiBase() + "/me/events";
    }

    @Override
    protected String eventUrl(String eventId) {
        return eventsUrl() + "/" + UriUtils.encodePathSegment(eventId, StandardCharsets.UTF_8);
    }

    @Override
    protected HttpMethod updateMethod() {
        return HttpMethod.PATCH;
    }

    @Override
    protected Map<String, Object> eventPayload(Appointment appointment) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contentType", "text");
        body.put("content", description(appointment));

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("subject", IcsFeedWriter.summary(appointment));
        event.put("body", body);
        event.put("start", when(appointment.getStartTime()));
        event.put("end", when(appointment.getEndTime()));
        return event;
    }

    private Map<String, Object> when(LocalDateTime time) {
        Map<String, Object> when = new LinkedHashMap<>();
        when.put("dateTime", time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        when.put("timeZone", zone.getId());
        return when;
    }
}
