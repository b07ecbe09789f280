package com.smallbiz.agent.service;

import com.smallbiz.agent.calendar.CalendarSyncService;
import com.smallbiz.agent.component.ResponsePhrases;
import com.smallbiz.agent.conversation.CallIntent;
import com.smallbiz.agent.conversation.TriageAction;
import com.smallbiz.agent.dto.AppointmentDraft;
import com.smallbiz.agent.dto.AppointmentRequestResult;
import com.smallbiz.agent.dto.AvailableSlot;
import com.smallbiz.agent.dto.BookingRequest;
import com.smallbiz.agent.dto.BookingResult;
import com.smallbiz.agent.dto.SlotQuery;
import com.smallbiz.agent.dto.TextMessageRequest;
import com.smallbiz.agent.dto.TriageResult;
import com.smallbiz.agent.dto.VoiceCallRequest;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.entity.BusinessHours;
import com.smallbiz.agent.entity.ReceptionistConfig;
import com.smallbiz.agent.entity.ServiceOffering;
import com.smallbiz.agent.repository.BusinessHoursRepository;
import com.smallbiz.agent.repository.ReceptionistConfigRepository;
import com.smallbiz.agent.repository.ServiceOfferingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CallTriageServiceTest {

    /** Monday 2026-03-02, 10:00 UTC. */
    private static final Instant MONDAY_TEN = Instant.parse("2026-03-02T10:00:00Z");
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    private ReceptionistConfigRepository configRepository;
    private BusinessHoursRepository hoursRepository;
    private ServiceOfferingRepository serviceRepository;
    private AvailabilityService availabilityService;
    private BookingService bookingService;
    private CalendarSyncService calendarSyncService;
    private CallLogService callLogService;
    private ReceptionistConfig config;

    @BeforeEach
    void setUp() {
        configRepository = mock(ReceptionistConfigRepository.class);
        hoursRepository = mock(BusinessHoursRepository.class);
        serviceRepository = mock(ServiceOfferingRepository.class);
        availabilityService = mock(AvailabilityService.class);
        bookingService = mock(BookingService.class);
        calendarSyncService = mock(CalendarSyncService.class);
        callLogService = mock(CallLogService.class);

        config = ReceptionistConfig.builder()
                .businessId(1L)
                .greeting("Thanks for calling Ace Plumbing.")
                .afterHoursMessage("We are closed right now.")
                .emergencyKeywords(new ArrayList<>(List.of("emergency", "flooding")))
                .voicemailEnabled(true)
                .emergencyTransferNumber("+15550001111")
                .managerTransferNumber("+15550002222")
                .build();
        when(configRepository.findByBusinessId(1L)).thenReturn(Optional.of(config));

        List<BusinessHours> week = new ArrayList<>();
        for (int day = 1; day <= 5; day++) {
            week.add(BusinessHours.builder().businessId(1L).dayOfWeek(day)
                    .openTime(LocalTime.of(9, 0)).closeTime(LocalTime.of(17, 0)).build());
        }
        week.add(BusinessHours.builder().businessId(1L).dayOfWeek(6).closed(true).build());
        when(hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(1L)).thenReturn(week);
    }

    private CallTriageService service(Instant now) {
        return new CallTriageService(configRepository, hoursRepository, serviceRepository, new IntentClassifier(),
                new ResponsePhrases(), availabilityService, bookingService, calendarSyncService, callLogService,
                Clock.fixed(now, ZoneOffset.UTC));
    }

    private static TextMessageRequest text(String message) {
        return new TextMessageRequest(1L, "+15559990000", message, null, null);
    }

    @Test
    void emergencyOverridesAppointmentIntent() {
        TriageResult result = service(MONDAY_TEN).processCall(
                new VoiceCallRequest(1L, "CA1", "+15559990000", "I have an emergency, I need an appointment", null));

        assertThat(result.action()).isEqualTo(TriageAction.TRANSFER_EMERGENCY);
        assertThat(result.intent()).isEqualTo(CallIntent.EMERGENCY);
        assertThat(result.emergency()).isTrue();
        assertThat(result.emergencySeverity()).isEqualTo(1);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.93);
        assertThat(result.transferNumber()).isEqualTo("+15550001111");
        assertThat(result.matchedKeywords()).containsExactly("emergency");
        verify(callLogService).recordTriage(any(), eq(result));
    }

    @Test
    void emergencyIsTransferredEvenAfterHours() {
        TriageResult result = service(Instant.parse("2026-03-02T22:00:00Z")).processCall(text("basement flooding"));

        assertThat(result.action()).isEqualTo(TriageAction.TRANSFER_EMERGENCY);
        assertThat(result.businessHours()).isFalse();
    }

    @Test
    void withinHoursIntentsMapToActions() {
        CallTriageService service = service(MONDAY_TEN);

        assertThat(service.processCall(text("Can I book an appointment?")).action()).isEqualTo(TriageAction.SCHEDULE_APPOINTMENT);
        assertThat(service.processCall(text("What is the price of a visit?")).action()).isEqualTo(TriageAction.PROVIDE_INFO);
        assertThat(service.processCall(text("Any progress on my job?")).action()).isEqualTo(TriageAction.CHECK_STATUS);
        assertThat(service.processCall(text("I need to pay my invoice")).action()).isEqualTo(TriageAction.PAYMENT_OPTIONS);
        assertThat(service.processCall(text("What's your address?")).action()).isEqualTo(TriageAction.PROVIDE_LOCATION);
        assertThat(service.processCall(text("hello there")).action()).isEqualTo(TriageAction.CONTINUE_CONVERSATION);
    }

    @Test
    void complaintIsTransferredToManager() {
        TriageResult result = service(MONDAY_TEN).processCall(text("I have a complaint about the work"));

        assertThat(result.action()).isEqualTo(TriageAction.TRANSFER_TO_MANAGER);
        assertThat(result.transferNumber()).isEqualTo("+15550002222");
    }

    @Test
    void hoursAnswerListsTheWeekInTwelveHourFormat() {
        TriageResult result = service(MONDAY_TEN).processCall(text("What are your hours?"));

        assertThat(result.action()).isEqualTo(TriageAction.PROVIDE_HOURS);
        assertThat(result.response()).startsWith("Our business hours are: Monday: 9:00 AM to 5:00 PM")
                .contains("Saturday: Closed");
    }

    @Test
    void servicesAnswerNamesActiveServices() {
        when(serviceRepository.findByBusinessIdAndActiveTrueOrderByName(1L)).thenReturn(List.of(
                ServiceOffering.builder().businessId(1L).name("Drain cleaning").durationMinutes(60).build(),
                ServiceOffering.builder().businessId(1L).name("Leak repair").durationMinutes(90).build()));

        TriageResult result = service(MONDAY_TEN).processCall(text("Which services do you offer?"));

        assertThat(result.action()).isEqualTo(TriageAction.LIST_SERVICES);
        assertThat(result.response()).contains("Drain cleaning, Leak repair");
    }

    @Test
    void afterHoursRoutesByVoicemailSetting() {
        CallTriageService service = service(Instant.parse("2026-03-02T20:00:00Z"));

        TriageResult appointment = service.processCall(text("I want to book an appointment"));
        TriageResult question = service.processCall(text("What is the price?"));

        assertThat(appointment.action()).isEqualTo(TriageAction.SCHEDULE_APPOINTMENT);
        assertThat(appointment.response()).startsWith("We are closed right now.");
        assertThat(question.action()).isEqualTo(TriageAction.TAKE_VOICEMAIL);
        assertThat(question.businessHours()).isFalse();

        config.setVoicemailEnabled(false);
        assertThat(service.processCall(text("What is the price?")).action()).isEqualTo(TriageAction.PROVIDE_INFO);
    }

    @Test
    void closingMinuteStillCountsAsOpen() {
        TriageResult atClose = service(Instant.parse("2026-03-02T17:00:00Z")).processCall(text("hello there"));
        TriageResult saturday = service(Instant.parse("2026-03-07T10:00:00Z")).processCall(text("hello there"));

        assertThat(atClose.businessHours()).isTrue();
        assertThat(saturday.businessHours()).isFalse();
    }

    @Test
    void knownCallerIsGreetedByName() {
        TriageResult result = service(MONDAY_TEN).processCall(
                new TextMessageRequest(1L, "+15559990000", "hello there", "Dana", "dana@example.com"));

        assertThat(result.response()).isEqualTo("Hello Dana. Thanks for calling Ace Plumbing.");
    }

    @Test
    void missingConfigurationYieldsFallback() {
        TriageResult result = service(MONDAY_TEN).processCall(new TextMessageRequest(2L, "x", "book", null, null));

        assertThat(result.action()).isEqualTo(TriageAction.HANDLE_ERROR);
        assertThat(result.intent()).isEqualTo(CallIntent.ERROR);
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.businessHours()).isTrue();
        assertThat(result.response()).isEqualTo(ResponsePhrases.TECHNICAL_ISSUE);
    }

    @Test
    void unexpectedFailureYieldsFallback() {
        when(hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(1L)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(service(MONDAY_TEN).processCall(text("book")).action()).isEqualTo(TriageAction.HANDLE_ERROR);
    }

    @Test
    void takenSlotOffersSameDayAlternatives() {
        LocalDateTime start = MONDAY.atTime(10, 0);
        when(bookingService.isTimeSlotAvailable(1L, start, start.plusHours(1), null)).thenReturn(false);
        AvailableSlot alternative = new AvailableSlot(MONDAY.atTime(11, 0), MONDAY.atTime(12, 0), true);
        when(availabilityService.findSlots(eq(1L), eq(MONDAY), eq(MONDAY), any(SlotQuery.class)))
                .thenAnswer(inv -> Stream.of(alternative));

        AppointmentRequestResult result = service(MONDAY_TEN).processAppointmentRequest(1L, 2L,
                new AppointmentDraft(start, start.plusHours(1), null, null, null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("The requested time is not available. Here are some alternative times that are available.");
        assertThat(result.error()).isEqualTo("Requested time slot is already booked.");
        assertThat(result.timeSlots()).containsExactly(alternative);
        verify(bookingService, never()).createAppointmentSafely(any());
    }

    @Test
    void freeSlotIsBookedLoggedAndSynced() {
        LocalDateTime start = MONDAY.atTime(14, 0);
        when(bookingService.isTimeSlotAvailable(1L, start, start.plusHours(1), null)).thenReturn(true);
        when(bookingService.createAppointmentSafely(any(BookingRequest.class))).thenReturn(
                BookingResult.success(Appointment.builder().id(55L).businessId(1L).customerId(2L)
                        .startTime(start).endTime(start.plusHours(1)).build()));

        AppointmentRequestResult result = service(MONDAY_TEN).processAppointmentRequest(1L, 2L,
                new AppointmentDraft(start, start.plusHours(1), null, null, "Kitchen sink", "caller transcript"));

        assertThat(result.success()).isTrue();
        assertThat(result.appointmentId()).isEqualTo(55L);
        verify(callLogService).recordBooking(1L, 55L, "caller transcript");
        verify(calendarSyncService).syncAppointmentInBackground(55L);
    }

    @Test
    void lostRaceIsReportedAsConflictWithAlternatives() {
        LocalDateTime start = MONDAY.atTime(14, 0);
        when(bookingService.isTimeSlotAvailable(1L, start, start.plusHours(1), null)).thenReturn(true);
        when(bookingService.createAppointmentSafely(any(BookingRequest.class)))
                .thenReturn(BookingResult.conflict("This time slot is already booked. Please select a different time."));
        when(availabilityService.findSlots(eq(1L), eq(MONDAY), eq(MONDAY), any(SlotQuery.class)))
                .thenAnswer(inv -> Stream.empty());

        AppointmentRequestResult result = service(MONDAY_TEN).processAppointmentRequest(1L, 2L,
                new AppointmentDraft(start, start.plusHours(1), null, null, null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Requested time slot is already booked.");
        verify(calendarSyncService, never()).syncAppointmentInBackground(anyLong());
    }

    @Test
    void invertedIntervalIsRejectedWithoutOfferingAlternatives() {
        LocalDateTime start = MONDAY.atTime(14, 0);

        AppointmentRequestResult result = service(MONDAY_TEN).processAppointmentRequest(1L, 2L,
                new AppointmentDraft(start, start, null, null, null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Unable to schedule appointment");
        assertThat(result.error()).isEqualTo("End time must be after start time");
        assertThat(result.timeSlots()).isNull();
        verify(bookingService, never()).isTimeSlotAvailable(any(), any(), any(), any());
        verify(availabilityService, never()).findSlots(any(), any(), any(), any());
    }

    @Test
    void withoutTimesUpcomingSlotsAreListed() {
        AvailableSlot past = new AvailableSlot(MONDAY.atTime(9, 0), MONDAY.atTime(10, 0), true);
        AvailableSlot upcoming = new AvailableSlot(MONDAY.atTime(11, 0), MONDAY.atTime(12, 0), true);
        when(availabilityService.findSlots(eq(1L), eq(MONDAY), eq(MONDAY.plusDays(7)), any(SlotQuery.class)))
                .thenAnswer(inv -> Stream.of(past, upcoming));

        AppointmentRequestResult result = service(MONDAY_TEN).processAppointmentRequest(1L, 2L, null);

        assertThat(result.success()).isFalse();
        assertThat(result.timeSlots()).containsExactly(upcoming);
        verify(bookingService, never()).createAppointmentSafely(any());
    }
}
