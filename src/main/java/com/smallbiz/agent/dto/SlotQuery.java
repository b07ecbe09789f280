package com.smallbiz.agent.dto;

/**
 * Optional filters for a slot search. Zero or negative minutes are rejected by the availability service.
 */
public record SlotQuery(Long serviceId, Long staffId, int slotGranularityMinutes, int defaultDurationMinutes) {

    public static final int DEFAULT_GRANULARITY_MINUTES = 30;
    public static final int DEFAULT_DURATION_MINUTES = 60;

    public static SlotQuery defaults() {
        return new SlotQuery(null, null, DEFAULT_GRANULARITY_MINUTES, DEFAULT_DURATION_MINUTES);
    }

    public static SlotQuery of(Long serviceId, Long staffId) {
        return new SlotQuery(serviceId, staffId, DEFAULT_GRANULARITY_MINUTES, DEFAULT_DURATION_MINUTES);
    }

    public SlotQuery withGranularity(int minutes) {
        return new SlotQuery(serviceId, staffId, minutes, defaultDurationMinutes);
    }

    public SlotQuery withDefaultDuration(int minutes) {
        return new SlotQuery(serviceId, staffId, slotGranularityMinutes, minutes);
    }
}
