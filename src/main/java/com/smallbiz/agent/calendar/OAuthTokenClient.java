package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.exception.ProviderSyncException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Exchanges an OAuth authorization code for tokens at the provider's token endpoint.
 */
@Component
public class OAuthTokenClient {

    private final RestTemplate restTemplate;

    public OAuthTokenClient(RestTemplateBuilder builder, CalendarProperties calendarProperties) {
        this.restTemplate = builder
                .setConnectTimeout(calendarProperties.http().connectTimeout())
                .setReadTimeout(calendarProperties.http().readTimeout())
                .build();
    }

    public TokenResponse exchangeCode(CalendarProvider provider, CalendarProperties.Provider settings,
                                      String code, String redirectUri) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("client_id", settings.clientId());
        body.add("client_secret", settings.clientSecret());
        body.add("redirect_uri", redirectUri);
        body.add("grant_type", "authorization_code");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        JsonNode response;
        try {
            response = restTemplate.postForObject(settings.tokenUri(), new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new ProviderSyncException(provider, "Token exchange failed", e);
        }
        String accessToken = response != null ? response.path("access_token").asText(null) : null;
        if (StringUtils.isBlank(accessToken)) {
            throw new ProviderSyncException(provider, "Token exchange returned no access token");
        }
        String refreshToken = response.path("refresh_token").asText(null);
        long expiresIn = response.path("expires_in").asLong(3600);
        return new TokenResponse(accessToken, refreshToken, expiresIn);
    }

    public record TokenResponse(String accessToken, String refreshToken, long expiresInSeconds) {
    }
}
