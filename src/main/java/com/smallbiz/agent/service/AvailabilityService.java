package com.smallbiz.agent.service;

import com.smallbiz.agent.dto.AvailableSlot;
import com.smallbiz.agent.dto.SlotQuery;
import com.smallbiz.agent.entity.BusinessHours;
import com.smallbiz.agent.entity.ServiceOffering;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.repository.BusinessHoursRepository;
import com.smallbiz.agent.repository.ServiceOfferingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Candidate slot generation from weekly opening hours.
 * Opening hours and the service duration are read up front; the booking check runs per slot as the stream is consumed.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final BusinessHoursRepository hoursRepository;
    private final ServiceOfferingRepository serviceRepository;
    private final BookingService bookingService;

    public AvailabilityService(BusinessHoursRepository hoursRepository,
                               ServiceOfferingRepository serviceRepository,
                               BookingService bookingService) {
        this.hoursRepository = hoursRepository;
        this.serviceRepository = serviceRepository;
        this.bookingService = bookingService;
    }

    /**
     * Walks every day of {@code [fromDate, toDate]} from opening to closing time in granularity steps.
     * A slot never runs past closing time, and closed or unconfigured days yield nothing.
     */
    public Stream<AvailableSlot> findSlots(Long businessId, LocalDate fromDate, LocalDate toDate, SlotQuery query) {
        SlotQuery q = query != null ? query : SlotQuery.defaults();
        if (businessId == null) {
            throw new ValidationException("Business is required");
        }
        if (fromDate == null || toDate == null) {
            throw new ValidationException("Date range is required");
        }
        if (toDate.isBefore(fromDate)) {
            throw new ValidationException("End date must not be before start date");
        }
        if (q.slotGranularityMinutes() <= 0) {
            throw new ValidationException("Slot granularity must be positive");
        }
        int duration = resolveDuration(businessId, q);
        if (duration <= 0) {
            throw new ValidationException("Slot duration must be positive");
        }

        Map<Integer, BusinessHours> hoursByDay = hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(businessId).stream()
                .collect(Collectors.toMap(BusinessHours::getDayOfWeek, Function.identity(), (a, b) -> a));
        log.debug("Slot search business={} {}..{} duration={}m step={}m", businessId, fromDate, toDate, duration, q.slotGranularityMinutes());

        return fromDate.datesUntil(toDate.plusDays(1))
                .flatMap(day -> candidateStarts(day, hoursByDay.get(day.getDayOfWeek().getValue()), q.slotGranularityMinutes(), duration))
                .map(start -> {
                    LocalDateTime end = start.plusMinutes(duration);
                    return new AvailableSlot(start, end,
                            bookingService.isTimeSlotAvailable(businessId, start, end, q.staffId()));
                });
    }

    private static Stream<LocalDateTime> candidateStarts(LocalDate day, BusinessHours hours, int granularity, int duration) {
        if (hours == null || !hours.isOpenDay()) {
            return Stream.empty();
        }
        LocalDateTime close = day.atTime(hours.getCloseTime());
        return Stream.iterate(day.atTime(hours.getOpenTime()), t -> t.isBefore(close), t -> t.plusMinutes(granularity))
                .filter(start -> !start.plusMinutes(duration).isAfter(close));
    }

    private int resolveDuration(Long businessId, SlotQuery q) {
        if (q.serviceId() != null) {
            Integer minutes = serviceRepository.findByIdAndBusinessIdAndActiveTrue(q.serviceId(), businessId)
                    .map(ServiceOffering::getDurationMinutes)
                    .orElse(null);
            if (minutes != null) {
                return minutes;
            }
            log.debug("Service {} not active for business {} or has no duration; using default {}m",
                    q.serviceId(), businessId, q.defaultDurationMinutes());
        }
        return q.defaultDurationMinutes();
    }
}
