package com.smallbiz.agent.calendar;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adapters by provider. Fails fast at startup when a provider has no adapter or two of them.
 */
@Component
public class CalendarAdapterRegistry {

    private final Map<CalendarProvider, CalendarProviderAdapter> byProvider;

    public CalendarAdapterRegistry(List<CalendarProviderAdapter> adapters) {
        EnumMap<CalendarProvider, CalendarProviderAdapter> map = new EnumMap<>(CalendarProvider.class);
        for (CalendarProviderAdapter adapter : adapters) {
            CalendarProviderAdapter previous = map.put(adapter.provider(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate calendar adapter for provider: " + adapter.provider());
            }
        }
        for (CalendarProvider provider : CalendarProvider.values()) {
            if (!map.containsKey(provider)) {
                throw new IllegalStateException("No calendar adapter registered for provider: " + provider);
            }
        }
        this.byProvider = map;
    }

    public CalendarProviderAdapter get(CalendarProvider provider) {
        return byProvider.get(provider);
    }

    public Collection<CalendarProviderAdapter> all() {
        return byProvider.values();
    }
}
