package com.smallbiz.agent.service;

import com.smallbiz.agent.dto.AvailableSlot;
import com.smallbiz.agent.dto.SlotQuery;
import com.smallbiz.agent.entity.BusinessHours;
import com.smallbiz.agent.entity.ServiceOffering;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.repository.BusinessHoursRepository;
import com.smallbiz.agent.repository.ServiceOfferingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AvailabilityServiceTest {

    /** 2026-03-02 is a Monday. */
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Mock
    BusinessHoursRepository hoursRepository;
    @Mock
    ServiceOfferingRepository serviceRepository;
    @Mock
    BookingService bookingService;
    @InjectMocks
    AvailabilityService availabilityService;

    @BeforeEach
    void setUp() {
        when(hoursRepository.findByBusinessIdOrderByDayOfWeekAsc(1L)).thenReturn(List.of(
                hours(1, LocalTime.of(9, 0), LocalTime.of(12, 0), false),
                hours(2, LocalTime.of(9, 0), LocalTime.of(10, 0), false),
                hours(3, null, null, true)));
        when(bookingService.isTimeSlotAvailable(eq(1L), any(), any(), any())).thenReturn(true);
    }

    private static BusinessHours hours(int day, LocalTime open, LocalTime close, boolean closed) {
        return BusinessHours.builder().businessId(1L).dayOfWeek(day).openTime(open).closeTime(close).closed(closed).build();
    }

    private List<AvailableSlot> slots(LocalDate from, LocalDate to, SlotQuery query) {
        return availabilityService.findSlots(1L, from, to, query).collect(Collectors.toList());
    }

    @Test
    void walksOpeningHoursWithoutCrossingClose() {
        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.defaults());

        assertThat(slots).extracting(AvailableSlot::start).containsExactly(
                MONDAY.atTime(9, 0), MONDAY.atTime(9, 30), MONDAY.atTime(10, 0),
                MONDAY.atTime(10, 30), MONDAY.atTime(11, 0));
        assertThat(slots).allSatisfy(s -> assertThat(s.end()).isEqualTo(s.start().plusMinutes(60)));
        assertThat(slots).allMatch(AvailableSlot::available);
    }

    @Test
    void closedAndUnconfiguredDaysYieldNothing() {
        LocalDate wednesday = MONDAY.plusDays(2);
        LocalDate thursday = MONDAY.plusDays(3);

        assertThat(slots(wednesday, thursday, SlotQuery.defaults())).isEmpty();
    }

    @Test
    void rangeIsInclusiveOfBothEnds() {
        List<AvailableSlot> slots = slots(MONDAY, MONDAY.plusDays(1), SlotQuery.defaults());

        assertThat(slots).hasSize(6);
        assertThat(slots.get(5).start()).isEqualTo(MONDAY.plusDays(1).atTime(9, 0));
    }

    @Test
    void serviceDurationOverridesDefault() {
        when(serviceRepository.findByIdAndBusinessIdAndActiveTrue(4L, 1L)).thenReturn(Optional.of(
                ServiceOffering.builder().id(4L).businessId(1L).name("Inspection").durationMinutes(90).active(true).build()));

        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.of(4L, null));

        assertThat(slots).extracting(AvailableSlot::start)
                .containsExactly(MONDAY.atTime(9, 0), MONDAY.atTime(9, 30), MONDAY.atTime(10, 0), MONDAY.atTime(10, 30));
        assertThat(slots.get(0).end()).isEqualTo(MONDAY.atTime(10, 30));
    }

    @Test
    void unknownServiceFallsBackToDefaultDuration() {
        when(serviceRepository.findByIdAndBusinessIdAndActiveTrue(77L, 1L)).thenReturn(Optional.empty());

        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.of(77L, null).withDefaultDuration(120));

        assertThat(slots).extracting(AvailableSlot::start)
                .containsExactly(MONDAY.atTime(9, 0), MONDAY.atTime(9, 30), MONDAY.atTime(10, 0));
    }

    @Test
    void serviceOfAnotherBusinessDoesNotSetDuration() {
        when(serviceRepository.findById(5L)).thenReturn(Optional.of(
                ServiceOffering.builder().id(5L).businessId(2L).name("Overhaul").durationMinutes(180).active(true).build()));
        when(serviceRepository.findByIdAndBusinessIdAndActiveTrue(5L, 1L)).thenReturn(Optional.empty());

        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.of(5L, null));

        assertThat(slots).isNotEmpty().allSatisfy(slot -> assertThat(slot.end()).isEqualTo(slot.start().plusMinutes(60)));
        verify(serviceRepository).findByIdAndBusinessIdAndActiveTrue(5L, 1L);
    }

    @Test
    void bookedSlotsAreFlaggedNotDropped() {
        LocalDateTime ten = MONDAY.atTime(10, 0);
        when(bookingService.isTimeSlotAvailable(1L, ten, ten.plusMinutes(60), null)).thenReturn(false);

        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.defaults());

        assertThat(slots).hasSize(5);
        assertThat(slots).filteredOn(s -> !s.available()).extracting(AvailableSlot::start).containsExactly(ten);
    }

    @Test
    void availabilityIsCheckedOnlyForConsumedSlots() {
        Optional<AvailableSlot> first = availabilityService.findSlots(1L, MONDAY, MONDAY.plusDays(30), SlotQuery.defaults())
                .findFirst();

        assertThat(first).isPresent();
        verify(bookingService, times(1)).isTimeSlotAvailable(eq(1L), any(), any(), isNull());
    }

    @Test
    void granularityControlsTheStep() {
        List<AvailableSlot> slots = slots(MONDAY, MONDAY, SlotQuery.defaults().withGranularity(60));

        assertThat(slots).extracting(AvailableSlot::start)
                .containsExactly(MONDAY.atTime(9, 0), MONDAY.atTime(10, 0), MONDAY.atTime(11, 0));
    }

    @Test
    void invalidQueriesAreRejected() {
        assertThatThrownBy(() -> availabilityService.findSlots(1L, MONDAY, MONDAY.minusDays(1), SlotQuery.defaults()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> availabilityService.findSlots(1L, MONDAY, MONDAY, SlotQuery.defaults().withGranularity(0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> availabilityService.findSlots(1L, MONDAY, MONDAY, SlotQuery.defaults().withDefaultDuration(-30)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> availabilityService.findSlots(null, MONDAY, MONDAY, SlotQuery.defaults()))
                .isInstanceOf(ValidationException.class);
    }
}
