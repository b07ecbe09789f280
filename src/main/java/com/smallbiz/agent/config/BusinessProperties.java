package com.smallbiz.agent.config;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Business wide settings. Appointment and opening times are wall-clock times in {@link #zone()}.
 */
@ConfigurationProperties(prefix = "app.business")
public record BusinessProperties(String zoneId, String publicBaseUrl) {

    public ZoneId zone() {
        return StringUtils.isBlank(zoneId) ? ZoneId.of("UTC") : ZoneId.of(zoneId.trim());
    }

    public String safePublicBaseUrl() {
        return StringUtils.isBlank(publicBaseUrl) ? "" : publicBaseUrl.trim().replaceAll("/$", "");
    }
}
