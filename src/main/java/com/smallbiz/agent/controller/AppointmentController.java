package com.smallbiz.agent.controller;

import com.smallbiz.agent.calendar.CalendarSyncService;
import com.smallbiz.agent.dto.AppointmentForm;
import com.smallbiz.agent.dto.AvailableSlot;
import com.smallbiz.agent.dto.BookingResult;
import com.smallbiz.agent.dto.ScheduleChange;
import com.smallbiz.agent.dto.SlotQuery;
import com.smallbiz.agent.dto.StatusChange;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.ConflictException;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.service.AvailabilityService;
import com.smallbiz.agent.service.BookingService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AvailabilityService availabilityService;
    private final BookingService bookingService;
    private final CalendarSyncService calendarSyncService;

    public AppointmentController(AvailabilityService availabilityService,
                                 BookingService bookingService,
                                 CalendarSyncService calendarSyncService) {
        this.availabilityService = availabilityService;
        this.bookingService = bookingService;
        this.calendarSyncService = calendarSyncService;
    }

    @GetMapping("/slots")
    public List<AvailableSlot> slots(@RequestParam Long businessId,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
                                     @RequestParam(required = false) Long serviceId,
                                     @RequestParam(required = false) Long staffId,
                                     @RequestParam(defaultValue = "" + SlotQuery.DEFAULT_GRANULARITY_MINUTES) int granularity,
                                     @RequestParam(defaultValue = "false") boolean onlyAvailable) {
        SlotQuery query = SlotQuery.of(serviceId, staffId).withGranularity(granularity);
        return availabilityService.findSlots(businessId, from, to, query)
                .filter(slot -> !onlyAvailable || slot.available())
                .collect(Collectors.toList());
    }

    @GetMapping("/availability")
    public Map<String, Object> availability(@RequestParam Long businessId,
                                            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
                                            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end,
                                            @RequestParam(required = false) Long staffId) {
        if (!start.isBefore(end)) {
            throw new ValidationException("End time must be after start time");
        }
        return Map.of("available", bookingService.isTimeSlotAvailable(businessId, start, end, staffId));
    }

    @PostMapping
    public ResponseEntity<BookingResult> create(@Valid @RequestBody AppointmentForm form) {
        BookingResult result = bookingService.createAppointmentSafely(form.toBookingRequest());
        if (result.success()) {
            calendarSyncService.syncAppointmentInBackground(result.appointment().getId());
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        }
        if (result.isConflict()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        if (result.errorType() == BookingResult.Failure.INVALID) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }

    @GetMapping("/{id}")
    public Appointment get(@PathVariable Long id) {
        return bookingService.getAppointment(id);
    }

    @GetMapping
    public List<Appointment> list(@RequestParam Long businessId) {
        return bookingService.listAppointments(businessId);
    }

    @PatchMapping("/{id}/status")
    public Appointment updateStatus(@PathVariable Long id, @Valid @RequestBody StatusChange change) {
        Appointment updated = bookingService.updateStatus(id, change.status());
        calendarSyncService.syncAppointmentInBackground(id);
        return updated;
    }

    @PutMapping("/{id}/schedule")
    public Appointment reschedule(@PathVariable Long id, @Valid @RequestBody ScheduleChange change) {
        Appointment moved;
        try {
            moved = bookingService.rescheduleAppointment(id, change.startTime(), change.endTime());
        } catch (ConflictException e) {
            LocalDate day = change.startTime().toLocalDate();
            Appointment current = bookingService.getAppointment(id);
            List<AvailableSlot> sameDay = availabilityService
                    .findSlots(current.getBusinessId(), day, day, SlotQuery.of(current.getServiceId(), current.getStaffId()))
                    .filter(AvailableSlot::available)
                    .collect(Collectors.toList());
            throw new ConflictException(e.getMessage(), sameDay);
        }
        calendarSyncService.syncAppointmentInBackground(id);
        return moved;
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        calendarSyncService.deleteAppointment(id);
        bookingService.deleteAppointment(id);
        return ResponseEntity.noContent().build();
    }
}
