package com.smallbiz.agent.controller;

import com.smallbiz.agent.calendar.CalendarIntegrationService;
import com.smallbiz.agent.calendar.CalendarProvider;
import com.smallbiz.agent.calendar.CalendarSyncService;
import com.smallbiz.agent.calendar.IntegrationStatus;
import com.smallbiz.agent.calendar.SyncResult;
import com.smallbiz.agent.entity.CalendarIntegration;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/calendar")
public class CalendarController {

    private final CalendarSyncService calendarSyncService;
    private final CalendarIntegrationService integrationService;

    public CalendarController(CalendarSyncService calendarSyncService, CalendarIntegrationService integrationService) {
        this.calendarSyncService = calendarSyncService;
        this.integrationService = integrationService;
    }

    @GetMapping("/status/{businessId}")
    public IntegrationStatus status(@PathVariable Long businessId) {
        return calendarSyncService.getIntegrationStatus(businessId);
    }

    @GetMapping("/auth-urls/{businessId}")
    public Map<String, String> authUrls(@PathVariable Long businessId) {
        return integrationService.getAuthUrls(businessId);
    }

    @GetMapping("/{provider}/callback")
    public Map<String, Object> callback(@PathVariable String provider,
                                        @RequestParam String code,
                                        @RequestParam String state) {
        CalendarIntegration integration = integrationService.handleOAuthCallback(CalendarProvider.fromCode(provider), code, state);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("provider", integration.getProvider().code());
        body.put("businessId", integration.getBusinessId());
        return body;
    }

    @GetMapping("/apple/subscription/{businessId}")
    public Map<String, String> appleSubscription(@PathVariable Long businessId) {
        return Map.of("url", integrationService.getAppleSubscriptionUrl(businessId));
    }

    @GetMapping("/appointment/{id}/ics")
    public Map<String, String> appointmentIcs(@PathVariable Long id) {
        return Map.of("url", integrationService.getAppointmentIcsUrl(id));
    }

    @PostMapping("/appointment/{id}/sync")
    public SyncResult sync(@PathVariable Long id) {
        return calendarSyncService.syncAppointment(id);
    }

    @DeleteMapping("/appointment/{id}")
    public SyncResult removeFromCalendars(@PathVariable Long id) {
        return calendarSyncService.deleteAppointment(id);
    }

    @DeleteMapping("/{businessId}/{provider}")
    public Map<String, Object> disconnect(@PathVariable Long businessId, @PathVariable String provider) {
        boolean ok = integrationService.disconnect(businessId, CalendarProvider.fromCode(provider));
        return Map.of("success", ok);
    }
}
