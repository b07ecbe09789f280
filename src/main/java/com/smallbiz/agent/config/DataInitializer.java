package com.smallbiz.agent.config;

import com.smallbiz.agent.entity.BusinessHours;
import com.smallbiz.agent.entity.ReceptionistConfig;
import com.smallbiz.agent.entity.ServiceOffering;
import com.smallbiz.agent.repository.BusinessHoursRepository;
import com.smallbiz.agent.repository.ReceptionistConfigRepository;
import com.smallbiz.agent.repository.ServiceOfferingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent seeder for a demo business: weekly hours, a few services and a receptionist configuration.
 * Safe to re-run.
 */
@Component
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final BusinessHoursRepository hoursRepository;
    private final ServiceOfferingRepository serviceRepository;
    private final ReceptionistConfigRepository configRepository;

    @Value("${app.seed.business-id:1}")
    private Long businessId;

    public DataInitializer(BusinessHoursRepository hoursRepository,
                           ServiceOfferingRepository serviceRepository,
                           ReceptionistConfigRepository configRepository) {
        this.hoursRepository = hoursRepository;
        this.serviceRepository = serviceRepository;
        this.configRepository = configRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        if (hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(businessId).isEmpty()) {
            for (int day = 1; day <= 7; day++) {
                boolean weekend = day >= 6;
                hoursRepository.save(BusinessHours.builder()
                        .businessId(businessId)
                        .dayOfWeek(day)
                        .openTime(weekend ? null : LocalTime.of(9, 0))
                        .closeTime(weekend ? null : LocalTime.of(17, 0))
                        .closed(weekend)
                        .build());
            }
            log.info("Seeded business hours for business {}", businessId);
        }

        if (serviceRepository.findByBusinessIdAndActiveTrueOrderByName(businessId).isEmpty()) {
            List.of(
                    ServiceOffering.builder().businessId(businessId).name("Consultation").durationMinutes(30).active(true).build(),
                    ServiceOffering.builder().businessId(businessId).name("Standard Repair").durationMinutes(60).active(true).build(),
                    ServiceOffering.builder().businessId(businessId).name("Full Inspection").durationMinutes(90).active(true).build()
            ).forEach(serviceRepository::save);
            log.info("Seeded services for business {}", businessId);
        }

        if (configRepository.findByBusinessId(businessId).isEmpty()) {
            configRepository.save(ReceptionistConfig.builder()
                    .businessId(businessId)
                    .greeting("Thanks for calling. How can I help you today?")
                    .afterHoursMessage("Our office is currently closed.")
                    .emergencyKeywords(new ArrayList<>(List.of("emergency", "urgent", "flooding", "leak", "fire")))
                    .voicemailEnabled(true)
                    .build());
            log.info("Seeded receptionist configuration for business {}", businessId);
        }
        log.info("DataInitializer: business {} ready", businessId);
    }
}
