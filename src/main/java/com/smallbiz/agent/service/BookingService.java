package com.smallbiz.agent.service;

import com.smallbiz.agent.dto.BookingRequest;
import com.smallbiz.agent.dto.BookingResult;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.ConflictException;
import com.smallbiz.agent.exception.NotFoundException;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Conflict checks and double-booking safe appointment writes.
 * The database is the only source of truth for what is booked.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final String CONFLICT_MESSAGE = "This time slot is already booked. Please select a different time.";
    static final String ERROR_MESSAGE = "An error occurred while booking the appointment.";

    private final AppointmentRepository appointmentRepository;
    private final BookingLockRegistry lockRegistry;
    private final TransactionOperations transactions;

    public BookingService(AppointmentRepository appointmentRepository,
                          BookingLockRegistry lockRegistry,
                          TransactionOperations transactions) {
        this.appointmentRepository = appointmentRepository;
        this.lockRegistry = lockRegistry;
        this.transactions = transactions;
    }

    /**
     * True when no active appointment of the business (of the given staff member, when one is named)
     * overlaps {@code [start, end)}. A lookup failure answers false so nothing is booked on a guess.
     */
    public boolean isTimeSlotAvailable(Long businessId, LocalDateTime start, LocalDateTime end, Long staffId) {
        return isTimeSlotAvailable(businessId, start, end, staffId, null);
    }

    public boolean isTimeSlotAvailable(Long businessId, LocalDateTime start, LocalDateTime end,
                                       Long staffId, Long excludeAppointmentId) {
        try {
            return activeAppointments(businessId, staffId).stream()
                    .filter(a -> excludeAppointmentId == null || !excludeAppointmentId.equals(a.getId()))
                    .noneMatch(a -> a.overlaps(start, end));
        } catch (DataAccessException e) {
            log.error("Availability check failed for business {}: {}", businessId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Books the slot unless it overlaps an active appointment. Check and insert happen under the
     * (business, staff) lock and the insert is committed before the lock is released.
     */
    public BookingResult createAppointmentSafely(BookingRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return BookingResult.invalid(invalid);
        }
        try {
            return lockRegistry.withLock(request.businessId(), request.staffId(), () -> transactions.execute(status -> {
                if (!isTimeSlotAvailable(request.businessId(), request.startTime(), request.endTime(), request.staffId())) {
                    log.info("Booking rejected for business {} at {}: slot taken", request.businessId(), request.startTime());
                    return BookingResult.conflict(CONFLICT_MESSAGE);
                }
                Appointment saved = appointmentRepository.save(Appointment.builder()
                        .businessId(request.businessId())
                        .customerId(request.customerId())
                        .staffId(request.staffId())
                        .serviceId(request.serviceId())
                        .startTime(request.startTime())
                        .endTime(request.endTime())
                        .notes(request.notes())
                        .status(Appointment.Status.SCHEDULED)
                        .build());
                log.info("Booked appointment: id={}, business={}, staff={}, {} - {}",
                        saved.getId(), saved.getBusinessId(), saved.getStaffId(), saved.getStartTime(), saved.getEndTime());
                return BookingResult.success(saved);
            }));
        } catch (DataAccessException e) {
            log.error("Booking failed for business {}: {}", request.businessId(), e.getMessage(), e);
            return BookingResult.error(ERROR_MESSAGE);
        }
    }

    public Appointment getAppointment(Long id) {
        return appointmentRepository.findById(id).orElseThrow(() -> NotFoundException.appointment(id));
    }

    public List<Appointment> listAppointments(Long businessId) {
        return appointmentRepository.findByBusinessIdOrderByStartTimeAsc(businessId);
    }

    public Appointment updateStatus(Long id, Appointment.Status status) {
        if (status == null) {
            throw new ValidationException("Status is required");
        }
        return transactions.execute(tx -> {
            Appointment appointment = getAppointment(id);
            appointment.setStatus(status);
            log.info("Appointment {} status -> {}", id, status);
            return appointmentRepository.save(appointment);
        });
    }

    /**
     * Moves an appointment; the appointment itself does not count as a conflict.
     *
     * @throws ConflictException when the new interval overlaps another active appointment
     */
    public Appointment rescheduleAppointment(Long id, LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("End time must be after start time");
        }
        Appointment current = getAppointment(id);
        return lockRegistry.withLock(current.getBusinessId(), current.getStaffId(), () -> transactions.execute(tx -> {
            Appointment appointment = getAppointment(id);
            if (!isTimeSlotAvailable(appointment.getBusinessId(), start, end, appointment.getStaffId(), id)) {
                throw new ConflictException(CONFLICT_MESSAGE);
            }
            appointment.setStartTime(start);
            appointment.setEndTime(end);
            log.info("Rescheduled appointment {} to {} - {}", id, start, end);
            return appointmentRepository.save(appointment);
        }));
    }

    public void deleteAppointment(Long id) {
        Appointment appointment = getAppointment(id);
        appointmentRepository.delete(appointment);
        log.info("Deleted appointment {}", id);
    }

    private List<Appointment> activeAppointments(Long businessId, Long staffId) {
        return staffId != null
                ? appointmentRepository.findByBusinessIdAndStaffIdAndStatusIn(businessId, staffId, Appointment.Status.ACTIVE)
                : appointmentRepository.findByBusinessIdAndStatusIn(businessId, Appointment.Status.ACTIVE);
    }

    private static String validate(BookingRequest request) {
        if (request == null || request.businessId() == null) {
            return "Business is required";
        }
        if (request.customerId() == null) {
            return "Customer is required";
        }
        if (request.startTime() == null || request.endTime() == null) {
            return "Start and end time are required";
        }
        if (!request.startTime().isBefore(request.endTime())) {
            return "End time must be after start time";
        }
        return null;
    }
}
