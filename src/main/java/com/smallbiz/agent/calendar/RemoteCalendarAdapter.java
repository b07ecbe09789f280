package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.smallbiz.agent.config.BusinessProperties;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.ProviderSyncException;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for calendars reached over an OAuth protected REST API.
 * Subclasses only describe the endpoints and the event payload.
 */
public abstract class RemoteCalendarAdapter implements CalendarProviderAdapter {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final CalendarProperties.Provider settings;
    protected final ZoneId zone;
    private final RestTemplate restTemplate;
    private final ProviderCredentialService credentials;
    private final CalendarIntegrationRepository integrationRepository;

    protected RemoteCalendarAdapter(CalendarProperties.Provider settings,
                                    CalendarProperties calendarProperties,
                                    BusinessProperties businessProperties,
                                    RestTemplateBuilder restTemplateBuilder,
                                    ProviderCredentialService credentials,
                                    CalendarIntegrationRepository integrationRepository) {
        this.settings = settings;
        this.zone = businessProperties.zone();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(calendarProperties.http().connectTimeout())
                .setReadTimeout(calendarProperties.http().readTimeout())
                .build();
        this.credentials = credentials;
        this.integrationRepository = integrationRepository;
    }

    protected abstract String eventsUrl();

    protected abstract String eventUrl(String eventId);

    protected abstract HttpMethod updateMethod();

    protected abstract Map<String, Object> eventPayload(Appointment appointment);

    @Override
    public boolean isConnected(Long businessId) {
        return integrationRepository.findByBusinessIdAndProvider(businessId, provider())
                .map(i -> StringUtils.isNotBlank(i.getAccessToken()))
                .orElse(false);
    }

    @Override
    public String syncAppointment(Long businessId, Appointment appointment) {
        String token = credentials.accessToken(businessId, provider()).orElse(null);
        if (token == null) {
            log.warn("No {} credentials for business {}; skipping appointment {}", provider().code(), businessId, appointment.getId());
            return null;
        }
        Map<String, Object> payload = eventPayload(appointment);
        String existing = provider().eventIdOf(appointment);
        if (StringUtils.isNotBlank(existing)) {
            try {
                exchange(eventUrl(existing), updateMethod(), token, payload);
                log.info("Updated {} event {} for appointment {}", provider().code(), existing, appointment.getId());
                return existing;
            } catch (HttpClientErrorException.NotFound e) {
                log.info("{} event {} is gone; recreating for appointment {}", provider().code(), existing, appointment.getId());
            } catch (RestClientException e) {
                throw new ProviderSyncException(provider(), "Failed to update event " + existing, e);
            }
        }
        try {
            ResponseEntity<JsonNode> response = exchange(eventsUrl(), HttpMethod.POST, token, payload);
            JsonNode body = response.getBody();
            String eventId = body != null ? body.path("id").asText(null) : null;
            if (StringUtils.isBlank(eventId)) {
                throw new ProviderSyncException(provider(), "Create response carried no event id");
            }
            log.info("Created {} event {} for appointment {}", provider().code(), eventId, appointment.getId());
            return eventId;
        } catch (RestClientException e) {
            throw new ProviderSyncException(provider(), "Failed to create event", e);
        }
    }

    @Override
    public boolean deleteAppointment(Long businessId, String eventId) {
        if (StringUtils.isBlank(eventId)) {
            return false;
        }
        String token = credentials.accessToken(businessId, provider()).orElse(null);
        if (token == null) {
            log.warn("No {} credentials for business {}; cannot delete event {}", provider().code(), businessId, eventId);
            return false;
        }
        try {
            exchange(eventUrl(eventId), HttpMethod.DELETE, token, null);
            log.info("Deleted {} event {}", provider().code(), eventId);
            return true;
        } catch (HttpClientErrorException.NotFound | HttpClientErrorException.Gone e) {
            log.info("{} event {} already removed", provider().code(), eventId);
            return true;
        } catch (RestClientException e) {
            throw new ProviderSyncException(provider(), "Failed to delete event " + eventId, e);
        }
    }

    private ResponseEntity<JsonNode> exchange(String url, HttpMethod method, String token, Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (payload != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return restTemplate.exchange(url, method, new HttpEntity<>(payload, headers), JsonNode.class);
    }

    protected String description(Appointment appointment) {
        return StringUtils.defaultString(appointment.getNotes());
    }
}
