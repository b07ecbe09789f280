package com.smallbiz.agent.calendar;

import java.util.Optional;

/**
 * Supplies a usable bearer token for a business's Google or Microsoft calendar.
 * Token refresh belongs to the implementation, not to the adapters.
 */
public interface ProviderCredentialService {

    Optional<String> accessToken(Long businessId, CalendarProvider provider);
}
