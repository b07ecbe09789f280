package com.smallbiz.agent.service;

import com.smallbiz.agent.calendar.CalendarSyncService;
import com.smallbiz.agent.component.ResponsePhrases;
import com.smallbiz.agent.conversation.CallIntent;
import com.smallbiz.agent.conversation.CallSession;
import com.smallbiz.agent.conversation.IntentMatch;
import com.smallbiz.agent.conversation.TriageAction;
import com.smallbiz.agent.dto.AppointmentDraft;
import com.smallbiz.agent.dto.AppointmentRequestResult;
import com.smallbiz.agent.dto.AvailableSlot;
import com.smallbiz.agent.dto.BookingRequest;
import com.smallbiz.agent.dto.BookingResult;
import com.smallbiz.agent.dto.CallRequest;
import com.smallbiz.agent.dto.SlotQuery;
import com.smallbiz.agent.dto.TriageResult;
import com.smallbiz.agent.dto.VoiceCallRequest;
import com.smallbiz.agent.entity.BusinessHours;
import com.smallbiz.agent.entity.ReceptionistConfig;
import com.smallbiz.agent.entity.ServiceOffering;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.repository.BusinessHoursRepository;
import com.smallbiz.agent.repository.ReceptionistConfigRepository;
import com.smallbiz.agent.repository.ServiceOfferingRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides how the virtual receptionist answers a caller, and books appointments requested during a call.
 */
@Service
public class CallTriageService {

    private static final Logger log = LoggerFactory.getLogger(CallTriageService.class);

    static final int SEARCH_DAYS = 7;

    private final ReceptionistConfigRepository configRepository;
    private final BusinessHoursRepository hoursRepository;
    private final ServiceOfferingRepository serviceRepository;
    private final IntentClassifier intentClassifier;
    private final ResponsePhrases phrases;
    private final AvailabilityService availabilityService;
    private final BookingService bookingService;
    private final CalendarSyncService calendarSyncService;
    private final CallLogService callLogService;
    private final Clock clock;

    public CallTriageService(ReceptionistConfigRepository configRepository,
                             BusinessHoursRepository hoursRepository,
                             ServiceOfferingRepository serviceRepository,
                             IntentClassifier intentClassifier,
                             ResponsePhrases phrases,
                             AvailabilityService availabilityService,
                             BookingService bookingService,
                             CalendarSyncService calendarSyncService,
                             CallLogService callLogService,
                             Clock clock) {
        this.configRepository = configRepository;
        this.hoursRepository = hoursRepository;
        this.serviceRepository = serviceRepository;
        this.intentClassifier = intentClassifier;
        this.phrases = phrases;
        this.availabilityService = availabilityService;
        this.bookingService = bookingService;
        this.calendarSyncService = calendarSyncService;
        this.callLogService = callLogService;
        this.clock = clock;
    }

    public TriageResult processCall(CallRequest request) {
        try {
            Long businessId = request.businessId();
            ReceptionistConfig config = configRepository.findByBusinessId(businessId).orElse(null);
            if (config == null) {
                log.warn("No receptionist configuration for business {}; answering with fallback", businessId);
                return TriageResult.fallback(ResponsePhrases.TECHNICAL_ISSUE);
            }

            List<BusinessHours> week = hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(businessId);
            boolean open = isOpen(week, LocalDateTime.now(clock));

            IntentMatch emergency = intentClassifier.detectEmergency(request.text(), config.getEmergencyKeywords());
            IntentMatch intent = emergency != null ? emergency : intentClassifier.classify(request.text());
            int severity = emergency != null ? IntentClassifier.severity(emergency.getMatchedKeywords()) : 0;
            CallSession session = new CallSession(request, intent, emergency != null, severity, open);

            TriageResult result = decide(session, config, week);
            if (request instanceof VoiceCallRequest voice) {
                log.info("Call {} business={} intent={} action={} emergency={}",
                        voice.callSid(), businessId, intent.getIntent().code(), result.action().code(), result.emergency());
            } else {
                log.info("{} message business={} intent={} action={}",
                        request.channel(), businessId, intent.getIntent().code(), result.action().code());
            }
            callLogService.recordTriage(session, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Triage failed for business {}: {}", request.businessId(), e.getMessage(), e);
            return TriageResult.fallback(ResponsePhrases.TECHNICAL_ISSUE);
        }
    }

    /**
     * Books the requested time when one is given, offering same-day alternatives when it is taken.
     * Without a concrete time it lists slots for the coming week instead.
     */
    public AppointmentRequestResult processAppointmentRequest(Long businessId, Long customerId, AppointmentDraft draft) {
        AppointmentDraft d = draft != null ? draft : new AppointmentDraft(null, null, null, null, null, null);
        try {
            if (d.hasConcreteTime()) {
                return bookRequestedTime(businessId, customerId, d);
            }
            LocalDate today = LocalDate.now(clock);
            LocalDateTime now = LocalDateTime.now(clock);
            List<AvailableSlot> slots = availabilityService
                    .findSlots(businessId, today, today.plusDays(SEARCH_DAYS), SlotQuery.of(d.serviceId(), d.staffId()))
                    .filter(slot -> !slot.start().isBefore(now))
                    .collect(Collectors.toList());
            if (slots.isEmpty()) {
                return AppointmentRequestResult.options(phrases.noAvailableTimes(), List.of());
            }
            return AppointmentRequestResult.options(phrases.availableTimes(), slots);
        } catch (ValidationException e) {
            return AppointmentRequestResult.failed(phrases.bookingFailed(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Appointment request failed for business {}: {}", businessId, e.getMessage(), e);
            return AppointmentRequestResult.failed(phrases.schedulingError(), e.getMessage());
        }
    }

    private AppointmentRequestResult bookRequestedTime(Long businessId, Long customerId, AppointmentDraft d) {
        if (!d.startTime().isBefore(d.endTime())) {
            throw new ValidationException("End time must be after start time");
        }
        if (!bookingService.isTimeSlotAvailable(businessId, d.startTime(), d.endTime(), d.staffId())) {
            return alternatives(businessId, d);
        }
        String notes = "Booked by virtual receptionist" + (StringUtils.isNotBlank(d.notes()) ? ": " + d.notes() : "");
        BookingResult booking = bookingService.createAppointmentSafely(new BookingRequest(
                businessId, customerId, d.staffId(), d.serviceId(), d.startTime(), d.endTime(), notes));
        if (booking.success()) {
            Long appointmentId = booking.appointment().getId();
            callLogService.recordBooking(businessId, appointmentId, d.transcript());
            calendarSyncService.syncAppointmentInBackground(appointmentId);
            return AppointmentRequestResult.booked(appointmentId, phrases.bookingConfirmed(d.startTime()));
        }
        if (booking.isConflict()) {
            log.info("Requested slot {} for business {} was taken concurrently", d.startTime(), businessId);
            return alternatives(businessId, d);
        }
        return AppointmentRequestResult.failed(phrases.bookingFailed(), booking.error());
    }

    private AppointmentRequestResult alternatives(Long businessId, AppointmentDraft d) {
        LocalDate day = d.startTime().toLocalDate();
        List<AvailableSlot> sameDay = availabilityService
                .findSlots(businessId, day, day, SlotQuery.of(d.serviceId(), d.staffId()))
                .collect(Collectors.toList());
        return AppointmentRequestResult.alternatives(phrases.alternativesOffered(), sameDay, phrases.slotTaken());
    }

    private TriageResult decide(CallSession session, ReceptionistConfig config, List<BusinessHours> week) {
        IntentMatch intent = session.intent();
        String callerName = session.request().callerName();
        TriageAction action;
        String response;
        String transferNumber = null;

        if (session.emergency()) {
            action = TriageAction.TRANSFER_EMERGENCY;
            response = phrases.emergencyTransfer();
            transferNumber = config.getEmergencyTransferNumber();
        } else if (!session.businessHours()) {
            if (intent.is(CallIntent.APPOINTMENT)) {
                action = TriageAction.SCHEDULE_APPOINTMENT;
                response = phrases.afterHoursScheduling(config.getAfterHoursMessage());
            } else if (config.isVoicemailEnabled()) {
                action = TriageAction.TAKE_VOICEMAIL;
                response = phrases.afterHoursVoicemail(config.getAfterHoursMessage());
            } else {
                action = TriageAction.PROVIDE_INFO;
                response = phrases.afterHoursInfo(config.getAfterHoursMessage());
            }
        } else {
            switch (intent.getIntent()) {
                case APPOINTMENT:
                    action = TriageAction.SCHEDULE_APPOINTMENT;
                    response = phrases.scheduleAppointment();
                    break;
                case INQUIRY:
                    action = TriageAction.PROVIDE_INFO;
                    response = phrases.provideInfo();
                    break;
                case STATUS:
                    action = TriageAction.CHECK_STATUS;
                    response = phrases.checkStatus();
                    break;
                case COMPLAINT:
                    action = TriageAction.TRANSFER_TO_MANAGER;
                    response = phrases.transferToManager();
                    transferNumber = config.getManagerTransferNumber();
                    break;
                case PAYMENT:
                    action = TriageAction.PAYMENT_OPTIONS;
                    response = phrases.paymentOptions();
                    break;
                case LOCATION:
                    action = TriageAction.PROVIDE_LOCATION;
                    response = phrases.provideLocation();
                    break;
                case HOURS:
                    action = TriageAction.PROVIDE_HOURS;
                    response = phrases.businessHours(week);
                    break;
                case SERVICES:
                    action = TriageAction.LIST_SERVICES;
                    response = phrases.listServices(serviceRepository
                            .findByBusinessIdAndActiveTrueOrderByName(session.request().businessId()).stream()
                            .map(ServiceOffering::getName)
                            .collect(Collectors.toList()));
                    break;
                default:
                    action = TriageAction.CONTINUE_CONVERSATION;
                    response = phrases.continueConversation(config.getGreeting());
            }
        }

        return new TriageResult(
                action,
                phrases.personalise(callerName, response),
                intent.getIntent(),
                intent.getConfidence(),
                session.emergency(),
                session.emergencySeverity(),
                session.businessHours(),
                intent.getMatchedKeywords(),
                transferNumber);
    }

    static boolean isOpen(List<BusinessHours> week, LocalDateTime now) {
        int today = now.getDayOfWeek().getValue();
        LocalTime time = now.toLocalTime();
        return week.stream()
                .filter(h -> h.getDayOfWeek() == today)
                .findFirst()
                .filter(BusinessHours::isOpenDay)
                .map(h -> !time.isBefore(h.getOpenTime()) && !time.isAfter(h.getCloseTime()))
                .orElse(false);
    }
}
