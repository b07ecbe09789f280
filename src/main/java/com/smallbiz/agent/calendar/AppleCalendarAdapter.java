package com.smallbiz.agent.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smallbiz.agent.config.BusinessProperties;
import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.entity.CalendarIntegration;
import com.smallbiz.agent.exception.ProviderSyncException;
import com.smallbiz.agent.repository.CalendarIntegrationRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Publishes appointments as static iCalendar files that Apple Calendar subscribes to.
 * <p>
 * Layout below the feed root: {@code subscriptions/business_{b}_calendar.ics} is the feed and
 * {@code events/business_{b}_event_{a}.ics} holds one appointment. The feed is rebuilt from all
 * fragments after every change and swapped in with a rename, so readers never see a partial file.
 * The APPLE integration row keeps an index of appointment id to fragment and event UID. Index updates commit in
 * their own transaction before the business lock is released, whatever transaction the caller has open.
 * Deletes fall back to the UID written in the fragments themselves when the index has no entry.
 */
@Component
public class AppleCalendarAdapter implements CalendarProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AppleCalendarAdapter.class);

    static final String SUBSCRIPTIONS_DIR = "subscriptions";
    static final String EVENTS_DIR = "events";

    private static final TypeReference<Map<String, FeedEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final CalendarIntegrationRepository integrationRepository;
    private final IcsFeedWriter icsFeedWriter;
    private final ObjectMapper objectMapper;
    private final Path root;
    private final BusinessProperties businessProperties;
    private final Clock clock;
    private final TransactionOperations indexTransactions;
    // never evicted: one monitor per business that has published to its feed
    private final Map<Long, Object> feedLocks = new ConcurrentHashMap<>();

    @Autowired
    public AppleCalendarAdapter(CalendarIntegrationRepository integrationRepository,
                                IcsFeedWriter icsFeedWriter,
                                ObjectMapper objectMapper,
                                CalendarProperties calendarProperties,
                                BusinessProperties businessProperties,
                                Clock clock,
                                PlatformTransactionManager transactionManager) {
        this(integrationRepository, icsFeedWriter, objectMapper, calendarProperties, businessProperties, clock,
                requiresNew(transactionManager));
    }

    AppleCalendarAdapter(CalendarIntegrationRepository integrationRepository,
                         IcsFeedWriter icsFeedWriter,
                         ObjectMapper objectMapper,
                         CalendarProperties calendarProperties,
                         BusinessProperties businessProperties,
                         Clock clock,
                         TransactionOperations indexTransactions) {
        this.integrationRepository = integrationRepository;
        this.icsFeedWriter = icsFeedWriter;
        this.objectMapper = objectMapper;
        this.root = calendarProperties.apple().root();
        this.businessProperties = businessProperties;
        this.clock = clock;
        this.indexTransactions = indexTransactions;
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.APPLE;
    }

    @Override
    public boolean isConnected(Long businessId) {
        return Files.exists(feedPath(businessId));
    }

    /**
     * Creates the (possibly empty) feed and the APPLE integration row when missing.
     *
     * @return path of the feed relative to the public base URL
     */
    public String ensureSubscriptionFeed(Long businessId) {
        synchronized (lockFor(businessId)) {
            try {
                Path feed = feedPath(businessId);
                if (!Files.exists(feed)) {
                    writeAtomically(feed, icsFeedWriter.emptyFeed(businessId));
                    log.info("Created Apple calendar feed for business {}", businessId);
                }
                indexTransactions.executeWithoutResult(status -> loadOrCreateIntegration(businessId));
                return "/calendar/" + SUBSCRIPTIONS_DIR + "/" + feedFilename(businessId);
            } catch (IOException | UncheckedIOException e) {
                throw new ProviderSyncException(CalendarProvider.APPLE, "Failed to create subscription feed", e);
            }
        }
    }

    @Override
    public String syncAppointment(Long businessId, Appointment appointment) {
        synchronized (lockFor(businessId)) {
            try {
                String key = String.valueOf(appointment.getId());
                String filename = eventFilename(businessId, appointment.getId());
                String uid = indexTransactions.execute(status -> {
                    CalendarIntegration integration = loadOrCreateIntegration(businessId);
                    Map<String, FeedEntry> index = readIndex(integration);
                    String eventId = appointment.getAppleEventId();
                    if (StringUtils.isBlank(eventId) && index.containsKey(key)) {
                        eventId = index.get(key).eventId();
                    }
                    if (StringUtils.isBlank(eventId)) {
                        eventId = UUID.randomUUID().toString().replace("-", "");
                    }
                    index.put(key, new FeedEntry(filename, eventId));
                    saveIndex(integration, index);
                    return eventId;
                });

                writeAtomically(eventsDir().resolve(filename),
                        icsFeedWriter.eventDocument(uid, appointment, businessProperties.zone(), clock.instant()));
                rebuildFeed(businessId);
                log.info("Published appointment {} to Apple feed of business {} (uid {})", appointment.getId(), businessId, uid);
                return uid;
            } catch (IOException | UncheckedIOException e) {
                throw new ProviderSyncException(CalendarProvider.APPLE, "Failed to write calendar files", e);
            }
        }
    }

    @Override
    public boolean deleteAppointment(Long businessId, String eventId) {
        if (StringUtils.isBlank(eventId)) {
            return false;
        }
        synchronized (lockFor(businessId)) {
            try {
                String indexed = indexTransactions.execute(status -> removeFromIndex(businessId, eventId));
                Optional<Path> fragment = indexed != null
                        ? Optional.of(eventsDir().resolve(indexed))
                        : findFragmentByUid(businessId, eventId);
                if (fragment.isEmpty()) {
                    log.warn("Apple event {} not found for business {}", eventId, businessId);
                    return false;
                }
                if (indexed == null) {
                    log.warn("Apple event {} of business {} was missing from the index; removing {}",
                            eventId, businessId, fragment.get().getFileName());
                }
                Files.deleteIfExists(fragment.get());
                rebuildFeed(businessId);
                log.info("Removed Apple event {} for business {}", eventId, businessId);
                return true;
            } catch (IOException | UncheckedIOException e) {
                throw new ProviderSyncException(CalendarProvider.APPLE, "Failed to remove event " + eventId, e);
            }
        }
    }

    public static String eventFilename(Long businessId, Long appointmentId) {
        return "business_" + businessId + "_event_" + appointmentId + ".ics";
    }

    static String feedFilename(Long businessId) {
        return "business_" + businessId + "_calendar.ics";
    }

    Path feedPath(Long businessId) {
        return root.resolve(SUBSCRIPTIONS_DIR).resolve(feedFilename(businessId));
    }

    Path eventsDir() {
        return root.resolve(EVENTS_DIR);
    }

    /**
     * @return the fragment filename recorded for the event, or null when the index does not know it
     */
    private String removeFromIndex(Long businessId, String eventId) {
        CalendarIntegration integration = integrationRepository
                .findByBusinessIdAndProvider(businessId, CalendarProvider.APPLE)
                .orElse(null);
        if (integration == null) {
            return null;
        }
        Map<String, FeedEntry> index = readIndex(integration);
        String key = index.entrySet().stream()
                .filter(e -> eventId.equals(e.getValue().eventId()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
        if (key == null) {
            return null;
        }
        String filename = index.remove(key).filename();
        saveIndex(integration, index);
        return filename;
    }

    private Optional<Path> findFragmentByUid(Long businessId, String eventId) throws IOException {
        String uidLine = "UID:" + eventId;
        for (Path fragment : fragments(businessId)) {
            if (Files.readAllLines(fragment, StandardCharsets.UTF_8).stream().anyMatch(uidLine::equals)) {
                return Optional.of(fragment);
            }
        }
        return Optional.empty();
    }

    private List<Path> fragments(Long businessId) throws IOException {
        String prefix = "business_" + businessId + "_event_";
        Path dir = eventsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(".ics");
                    })
                    .sorted(Comparator.comparingLong(p -> appointmentIdOf(p, prefix)))
                    .collect(Collectors.toList());
        }
    }

    private void rebuildFeed(Long businessId) throws IOException {
        List<String> documents = new ArrayList<>();
        for (Path fragment : fragments(businessId)) {
            documents.add(Files.readString(fragment, StandardCharsets.UTF_8));
        }
        writeAtomically(feedPath(businessId), icsFeedWriter.feed(businessId, documents));
    }

    private static long appointmentIdOf(Path fragment, String prefix) {
        String name = fragment.getFileName().toString();
        String id = name.substring(prefix.length(), name.length() - ".ics".length());
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private CalendarIntegration loadOrCreateIntegration(Long businessId) {
        return integrationRepository.findByBusinessIdAndProvider(businessId, CalendarProvider.APPLE)
                .orElseGet(() -> integrationRepository.save(CalendarIntegration.builder()
                        .businessId(businessId)
                        .provider(CalendarProvider.APPLE)
                        .providerData(writeIndex(new LinkedHashMap<>()))
                        .build()));
    }

    private Map<String, FeedEntry> readIndex(CalendarIntegration integration) {
        if (StringUtils.isBlank(integration.getProviderData())) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, FeedEntry> index = objectMapper.readValue(integration.getProviderData(), INDEX_TYPE);
            return index != null ? new LinkedHashMap<>(index) : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable Apple feed index for business {}, starting fresh: {}", integration.getBusinessId(), e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void saveIndex(CalendarIntegration integration, Map<String, FeedEntry> index) {
        integration.setProviderData(writeIndex(index));
        integrationRepository.save(integration);
    }

    private String writeIndex(Map<String, FeedEntry> index) {
        try {
            return objectMapper.writeValueAsString(index);
        } catch (JsonProcessingException e) {
            throw new ProviderSyncException(CalendarProvider.APPLE, "Failed to serialise feed index", e);
        }
    }

    private static TransactionOperations requiresNew(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    private Object lockFor(Long businessId) {
        return feedLocks.computeIfAbsent(businessId, id -> new Object());
    }

    /** One entry of the per-business fragment index. */
    public record FeedEntry(String filename, String eventId) {
    }
}
