package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the adapter against a real transaction manager: a caller holding its own transaction open
 * must not hide or overwrite index entries written by a concurrent sync of the same business.
 */
@SpringBootTest
class AppleFeedIndexConcurrencyTest {

    private static final long BUSINESS = 77L;

    @TempDir
    static Path feedRoot;

    @DynamicPropertySource
    static void feedDirectory(DynamicPropertyRegistry registry) {
        registry.add("app.calendar.apple.feed-dir", () -> feedRoot.toString());
    }

    @Autowired
    private AppleCalendarAdapter adapter;

    @Autowired
    private CalendarIntegrationRepository integrationRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ObjectMapper objectMapper;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static Appointment appointment(long id, int hour) {
        return Appointment.builder()
                .id(id)
                .businessId(BUSINESS)
                .customerId(1L)
                .startTime(LocalDateTime.of(2026, 3, 3, hour, 0))
                .endTime(LocalDateTime.of(2026, 3, 3, hour + 1, 0))
                .build();
    }

    @Test
    void syncInsideOpenTransactionKeepsConcurrentSyncEntry() throws Exception {
        CountDownLatch firstPublished = new CountDownLatch(1);
        CountDownLatch secondFinished = new CountDownLatch(1);
        TransactionTemplate outer = new TransactionTemplate(transactionManager);

        Future<String> first = pool.submit(() -> outer.execute(status -> {
            String uid = adapter.syncAppointment(BUSINESS, appointment(1L, 9));
            firstPublished.countDown();
            try {
                secondFinished.await(800, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return uid;
        }));
        assertThat(firstPublished.await(5, TimeUnit.SECONDS)).isTrue();
        Future<String> second = pool.submit(() -> {
            try {
                return adapter.syncAppointment(BUSINESS, appointment(2L, 11));
            } finally {
                secondFinished.countDown();
            }
        });

        String firstUid = first.get(10, TimeUnit.SECONDS);
        String secondUid = second.get(10, TimeUnit.SECONDS);

        String providerData = integrationRepository.findByBusinessIdAndProvider(BUSINESS, CalendarProvider.APPLE)
                .orElseThrow()
                .getProviderData();
        Map<String, AppleCalendarAdapter.FeedEntry> index =
                objectMapper.readValue(providerData, new TypeReference<Map<String, AppleCalendarAdapter.FeedEntry>>() {
                });
        assertThat(index).containsOnlyKeys("1", "2");
        assertThat(index.get("1").eventId()).isEqualTo(firstUid);
        assertThat(index.get("2").eventId()).isEqualTo(secondUid);

        assertThat(adapter.deleteAppointment(BUSINESS, secondUid)).isTrue();

        String feed = Files.readString(adapter.feedPath(BUSINESS), StandardCharsets.UTF_8);
        assertThat(feed).contains("UID:" + firstUid).doesNotContain("UID:" + secondUid);
    }
}
