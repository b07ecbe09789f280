package com.smallbiz.agent.config;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "app.calendar")
public record CalendarProperties(Sync sync, Http http, Provider google, Provider microsoft, Apple apple) {

    public CalendarProperties {
        if (sync == null) sync = new Sync(null, 0);
        if (http == null) http = new Http(null, null);
        if (google == null) google = Provider.googleDefaults();
        if (microsoft == null) microsoft = Provider.microsoftDefaults();
        if (apple == null) apple = new Apple(null);
    }

    /**
     * Fan-out limits. Every provider call is cancelled once {@code timeout} elapses.
     */
    public record Sync(Duration timeout, int poolSize) {
        public Sync {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);
            if (poolSize <= 0) poolSize = 6;
        }
    }

    public record Http(Duration connectTimeout, Duration readTimeout) {
        public Http {
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(3);
            if (readTimeout == null) readTimeout = Duration.ofSeconds(8);
        }
    }

    public record Provider(
            boolean enabled,
            String clientId,
            String clientSecret,
            String authUri,
            String tokenUri,
            String apiBase,
            String calendarId,
            String scopes,
            String redirectPath
    ) {

        static Provider googleDefaults() {
            return new Provider(false, null, null,
                    "https://accounts.google.com/o/oauth2/v2/auth",
                    "https://oauth2.googleapis.com/token",
                    "https://www.googleapis.com/calendar/v3",
                    "primary",
                    "https://www.googleapis.com/auth/calendar",
                    "/api/calendar/google/callback");
        }

        static Provider microsoftDefaults() {
            return new Provider(false, null, null,
                    "https://login.microsoftonline.com/common/oauth2/v2.0/authorize",
                    "https://login.microsoftonline.com/common/oauth2/v2.0/token",
                    "https://graph.microsoft.com/v1.0",
                    null,
                    "offline_access Calendars.ReadWrite",
                    "/api/calendar/microsoft/callback");
        }

        public boolean isOAuthConfigured() {
            return enabled && StringUtils.isNotBlank(clientId) && StringUtils.isNotBlank(clientSecret);
        }

        public String safeApiBase() {
            return StringUtils.removeEnd(StringUtils.trimToEmpty(apiBase), "/");
        }

        public String safeCalendarId() {
            return StringUtils.isBlank(calendarId) ? "primary" : calendarId;
        }
    }

    /**
     * Root of the statically hosted iCalendar files; {@code subscriptions/} and {@code events/} live below it.
     */
    public record Apple(String feedDir) {
        public Apple {
            if (StringUtils.isBlank(feedDir)) feedDir = "./public/calendar";
        }

        public Path root() {
            return Path.of(feedDir);
        }
    }
}
