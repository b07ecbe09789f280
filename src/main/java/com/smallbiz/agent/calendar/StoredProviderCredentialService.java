package com.smallbiz.agent.calendar;

import com.smallbiz.agent.entity.CalendarIntegration;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Hands out the access token stored by the OAuth callback. Expired tokens are still returned;
 * the provider answers 401 and the sync is reported as failed for that provider.
 */
@Service
public class StoredProviderCredentialService implements ProviderCredentialService {

    private static final Logger log = LoggerFactory.getLogger(StoredProviderCredentialService.class);

    private final CalendarIntegrationRepository integrationRepository;
    private final Clock clock;

    public StoredProviderCredentialService(CalendarIntegrationRepository integrationRepository, Clock clock) {
        this.integrationRepository = integrationRepository;
        this.clock = clock;
    }

    @Override
    public Optional<String> accessToken(Long businessId, CalendarProvider provider) {
        Optional<CalendarIntegration> integration = integrationRepository.findByBusinessIdAndProvider(businessId, provider);
        integration
                .filter(i -> i.getExpiresAt() != null && i.getExpiresAt().isBefore(clock.instant()))
                .ifPresent(i -> log.warn("{} token for business {} expired at {}", provider.code(), businessId, i.getExpiresAt()));
        return integration
                .map(CalendarIntegration::getAccessToken)
                .filter(StringUtils::isNotBlank);
    }
}
