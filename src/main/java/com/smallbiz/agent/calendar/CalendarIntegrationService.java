package com.smallbiz.agent.calendar;

import com.smallbiz.agent.config.BusinessProperties;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.entity.CalendarIntegration;
import com.smallbiz.agent.exception.NotFoundException;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.repository.AppointmentRepository;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connecting and disconnecting calendars: OAuth for Google and Microsoft, a subscription feed for Apple.
 * The OAuth {@code state} parameter carries the business id.
 */
@Service
public class CalendarIntegrationService {

    private static final Logger log = LoggerFactory.getLogger(CalendarIntegrationService.class);

    private final CalendarIntegrationRepository integrationRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppleCalendarAdapter appleCalendarAdapter;
    private final OAuthTokenClient tokenClient;
    private final CalendarProperties calendarProperties;
    private final BusinessProperties businessProperties;
    private final Clock clock;

    public CalendarIntegrationService(CalendarIntegrationRepository integrationRepository,
                                      AppointmentRepository appointmentRepository,
                                      AppleCalendarAdapter appleCalendarAdapter,
                                      OAuthTokenClient tokenClient,
                                      CalendarProperties calendarProperties,
                                      BusinessProperties businessProperties,
                                      Clock clock) {
        this.integrationRepository = integrationRepository;
        this.appointmentRepository = appointmentRepository;
        this.appleCalendarAdapter = appleCalendarAdapter;
        this.tokenClient = tokenClient;
        this.calendarProperties = calendarProperties;
        this.businessProperties = businessProperties;
        this.clock = clock;
    }

    /**
     * Consent URLs for the OAuth providers that are configured, plus the Apple subscription path.
     */
    public Map<String, String> getAuthUrls(Long businessId) {
        Map<String, String> urls = new LinkedHashMap<>();
        for (CalendarProvider provider : new CalendarProvider[]{CalendarProvider.GOOGLE, CalendarProvider.MICROSOFT}) {
            CalendarProperties.Provider settings = settingsFor(provider);
            if (!settings.isOAuthConfigured()) {
                continue;
            }
            UriComponentsBuilder builder = UriComponentsBuilder
                    .fromUriString(settings.authUri())
                    .queryParam("response_type", "code")
                    .queryParam("client_id", settings.clientId())
                    .queryParam("redirect_uri", redirectUri(settings))
                    .queryParam("scope", settings.scopes());
            if (provider == CalendarProvider.GOOGLE) {
                builder.queryParam("access_type", "offline");
            }
            urls.put(provider.code(), builder
                    .queryParam("prompt", "consent")
                    .queryParam("state", businessId)
                    .build()
                    .encode()
                    .toUriString());
        }
        urls.put("appleSubscription", businessProperties.safePublicBaseUrl()
                + "/calendar/" + AppleCalendarAdapter.SUBSCRIPTIONS_DIR + "/" + AppleCalendarAdapter.feedFilename(businessId));
        return urls;
    }

    @Transactional
    public CalendarIntegration handleOAuthCallback(CalendarProvider provider, String code, String state) {
        if (provider == CalendarProvider.APPLE) {
            throw new ValidationException("Unsupported calendar provider: " + provider.code());
        }
        if (StringUtils.isBlank(code)) {
            throw new ValidationException("Missing authorization code");
        }
        Long businessId = parseBusinessId(state);
        CalendarProperties.Provider settings = settingsFor(provider);
        OAuthTokenClient.TokenResponse tokens = tokenClient.exchangeCode(provider, settings, code, redirectUri(settings));

        CalendarIntegration integration = integrationRepository.findByBusinessIdAndProvider(businessId, provider)
                .orElseGet(() -> CalendarIntegration.builder().businessId(businessId).provider(provider).build());
        integration.setAccessToken(tokens.accessToken());
        if (StringUtils.isNotBlank(tokens.refreshToken())) {
            integration.setRefreshToken(tokens.refreshToken());
        }
        integration.setExpiresAt(clock.instant().plusSeconds(tokens.expiresInSeconds()));
        CalendarIntegration saved = integrationRepository.save(integration);
        log.info("{} calendar connected for business {}", provider.code(), businessId);
        return saved;
    }

    public String getAppleSubscriptionUrl(Long businessId) {
        return businessProperties.safePublicBaseUrl() + appleCalendarAdapter.ensureSubscriptionFeed(businessId);
    }

    /**
     * Publishes the appointment to the Apple feed and returns the URL of its single-event file.
     */
    public String getAppointmentIcsUrl(Long appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        String uid = appleCalendarAdapter.syncAppointment(appointment.getBusinessId(), appointment);
        if (!uid.equals(appointment.getAppleEventId())) {
            appointment.setAppleEventId(uid);
            appointmentRepository.save(appointment);
        }
        return businessProperties.safePublicBaseUrl() + "/calendar/" + AppleCalendarAdapter.EVENTS_DIR + "/"
                + AppleCalendarAdapter.eventFilename(appointment.getBusinessId(), appointment.getId());
    }

    /**
     * Removes stored OAuth credentials. Apple feeds are public files and cannot be disconnected here.
     */
    public boolean disconnect(Long businessId, CalendarProvider provider) {
        if (provider == CalendarProvider.APPLE) {
            throw new ValidationException("Unsupported calendar provider: " + provider.code());
        }
        int removed = integrationRepository.deleteByBusinessIdAndProvider(businessId, provider);
        log.info("{} calendar disconnected for business {} ({} row(s))", provider.code(), businessId, removed);
        return true;
    }

    private CalendarProperties.Provider settingsFor(CalendarProvider provider) {
        return provider == CalendarProvider.GOOGLE ? calendarProperties.google() : calendarProperties.microsoft();
    }

    private String redirectUri(CalendarProperties.Provider settings) {
        return businessProperties.safePublicBaseUrl() + settings.redirectPath();
    }

    private static Long parseBusinessId(String state) {
        try {
            return Long.valueOf(StringUtils.trimToEmpty(state));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid OAuth state");
        }
    }
}
