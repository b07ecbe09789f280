package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smallbiz.agent.config.BusinessProperties;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.entity.CalendarIntegration;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AppleCalendarAdapterTest {

    @TempDir
    Path feedRoot;

    private final AtomicReference<CalendarIntegration> stored = new AtomicReference<>();
    private CalendarIntegrationRepository integrationRepository;
    private AppleCalendarAdapter adapter;

    @BeforeEach
    void setUp() {
        integrationRepository = mock(CalendarIntegrationRepository.class);
        when(integrationRepository.findByBusinessIdAndProvider(anyLong(), eq(CalendarProvider.APPLE)))
                .thenAnswer(inv -> Optional.ofNullable(stored.get())
                        .filter(i -> i.getBusinessId().equals(inv.getArgument(0))));
        when(integrationRepository.save(any(CalendarIntegration.class))).thenAnswer(inv -> {
            stored.set(inv.getArgument(0));
            return inv.getArgument(0);
        });

        CalendarProperties properties = new CalendarProperties(null, null, null, null,
                new CalendarProperties.Apple(feedRoot.toString()));
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
        adapter = new AppleCalendarAdapter(integrationRepository, new IcsFeedWriter(), new ObjectMapper(),
                properties, new BusinessProperties("UTC", null), clock, TransactionOperations.withoutTransaction());
    }

    private static Appointment appointment(long id, Long serviceId, int hour) {
        return Appointment.builder()
                .id(id)
                .businessId(7L)
                .customerId(1L)
                .serviceId(serviceId)
                .startTime(LocalDateTime.of(2026, 3, 3, hour, 0))
                .endTime(LocalDateTime.of(2026, 3, 3, hour + 1, 0))
                .notes("Gate code 1234; ring twice")
                .build();
    }

    private String feed() throws Exception {
        return Files.readString(feedRoot.resolve("subscriptions/business_7_calendar.ics"), StandardCharsets.UTF_8);
    }

    private static int count(String text, String token) {
        Matcher m = Pattern.compile(Pattern.quote(token)).matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    @Test
    void feedContainsOneEventPerSyncedAppointment() throws Exception {
        String first = adapter.syncAppointment(7L, appointment(12L, 3L, 10));
        String second = adapter.syncAppointment(7L, appointment(13L, null, 14));

        assertThat(first).matches("[0-9a-f]{32}");
        assertThat(second).matches("[0-9a-f]{32}").isNotEqualTo(first);

        String feed = feed();
        assertThat(feed).startsWith("BEGIN:VCALENDAR\r\nVERSION:2.0\r\nPRODID:-//SmallBizAgent//Calendar//EN\r\n"
                + "CALSCALE:GREGORIAN\r\nMETHOD:PUBLISH\r\nX-WR-CALNAME:Business Calendar 7\r\n"
                + "X-WR-TIMEZONE:UTC\r\nX-WR-CALDESC:Appointment calendar for business 7\r\n");
        assertThat(feed).endsWith("END:VCALENDAR");
        assertThat(count(feed, "BEGIN:VEVENT")).isEqualTo(2);
        assertThat(feed).contains("UID:" + first, "UID:" + second)
                .contains("SUMMARY:Appointment #12\r\n", "SUMMARY:Appointment\r\n")
                .contains("DTSTART:20260303T100000Z", "DTEND:20260303T110000Z")
                .contains("DTSTAMP:20260301T080000Z")
                .contains("DESCRIPTION:Gate code 1234\\; ring twice");
        assertThat(adapter.isConnected(7L)).isTrue();
        assertThat(Files.exists(feedRoot.resolve("events/business_7_event_12.ics"))).isTrue();
    }

    @Test
    void resyncKeepsUidAndDoesNotDuplicate() throws Exception {
        Appointment appointment = appointment(12L, 3L, 10);
        String uid = adapter.syncAppointment(7L, appointment);

        appointment.setStartTime(LocalDateTime.of(2026, 3, 3, 15, 0));
        appointment.setEndTime(LocalDateTime.of(2026, 3, 3, 16, 0));
        assertThat(adapter.syncAppointment(7L, appointment)).isEqualTo(uid);

        String feed = feed();
        assertThat(count(feed, "BEGIN:VEVENT")).isEqualTo(1);
        assertThat(feed).contains("DTSTART:20260303T150000Z").doesNotContain("DTSTART:20260303T100000Z");
    }

    @Test
    void deleteRemovesEventFromFeed() throws Exception {
        String keep = adapter.syncAppointment(7L, appointment(12L, 3L, 10));
        String drop = adapter.syncAppointment(7L, appointment(13L, 3L, 14));

        assertThat(adapter.deleteAppointment(7L, drop)).isTrue();

        String feed = feed();
        assertThat(count(feed, "BEGIN:VEVENT")).isEqualTo(1);
        assertThat(feed).contains("UID:" + keep).doesNotContain("UID:" + drop);
        assertThat(Files.exists(feedRoot.resolve("events/business_7_event_13.ics"))).isFalse();
        assertThat(stored.get().getProviderData()).doesNotContain(drop);
    }

    @Test
    void deleteFindsFragmentByUidWhenIndexLostTheEntry() throws Exception {
        String keep = adapter.syncAppointment(7L, appointment(12L, 3L, 10));
        String lost = adapter.syncAppointment(7L, appointment(13L, 3L, 14));
        stored.get().setProviderData(stored.get().getProviderData().replaceAll(",?\"13\":\\{[^}]*\\}", ""));
        assertThat(stored.get().getProviderData()).doesNotContain(lost).contains(keep);

        assertThat(adapter.deleteAppointment(7L, lost)).isTrue();

        assertThat(feed()).contains("UID:" + keep).doesNotContain("UID:" + lost);
        assertThat(Files.exists(feedRoot.resolve("events/business_7_event_13.ics"))).isFalse();
    }

    @Test
    void unknownEventIdIsNotDeleted() {
        adapter.syncAppointment(7L, appointment(12L, 3L, 10));

        assertThat(adapter.deleteAppointment(7L, "ffffffffffffffffffffffffffffffff")).isFalse();
        assertThat(adapter.deleteAppointment(8L, "ffffffffffffffffffffffffffffffff")).isFalse();
    }

    @Test
    void subscriptionFeedCreatesEmptyCalendarAndIntegration() throws Exception {
        assertThat(adapter.isConnected(7L)).isFalse();

        String path = adapter.ensureSubscriptionFeed(7L);

        assertThat(path).isEqualTo("/calendar/subscriptions/business_7_calendar.ics");
        assertThat(adapter.isConnected(7L)).isTrue();
        assertThat(count(feed(), "BEGIN:VEVENT")).isZero();
        assertThat(stored.get().getProvider()).isEqualTo(CalendarProvider.APPLE);
    }
}
