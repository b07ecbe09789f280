package com.smallbiz.agent.calendar;

import com.smallbiz.agent.config.CalendarProperties;
import com.smallbiz.agent.entity.Appointment;
import com.smallbiz.agent.exception.NotFoundException;
import com.smallbiz.agent.repository.AppointmentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Mirrors appointments to every connected calendar.
 * <p>
 * Providers run in parallel on the sync pool and each is bounded by the configured timeout; a call
 * that overruns is cancelled and counted as failed. One provider failing never affects another.
 * Event ids that came back are written onto the appointment so a later sync updates instead of duplicating.
 */
@Service
public class CalendarSyncService {

    private static final Logger log = LoggerFactory.getLogger(CalendarSyncService.class);

    private final AppointmentRepository appointmentRepository;
    private final CalendarAdapterRegistry adapters;
    private final AsyncTaskExecutor syncExecutor;
    private final AsyncTaskExecutor dispatchExecutor;
    private final TransactionOperations transactions;
    private final Duration timeout;
    private final Clock clock;

    public CalendarSyncService(AppointmentRepository appointmentRepository,
                               CalendarAdapterRegistry adapters,
                               @Qualifier("calendarSyncExecutor") AsyncTaskExecutor syncExecutor,
                               @Qualifier("calendarDispatchExecutor") AsyncTaskExecutor dispatchExecutor,
                               TransactionOperations transactions,
                               CalendarProperties calendarProperties,
                               Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.adapters = adapters;
        this.syncExecutor = syncExecutor;
        this.dispatchExecutor = dispatchExecutor;
        this.transactions = transactions;
        this.timeout = calendarProperties.sync().timeout();
        this.clock = clock;
    }

    /**
     * Pushes the appointment to every connected calendar. A cancelled appointment is removed from the
     * calendars holding it instead.
     */
    public SyncResult syncAppointment(Long appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        if (appointment.getStatus() == Appointment.Status.CANCELLED) {
            log.debug("Appointment {} is cancelled; removing it from calendars", appointmentId);
            return deleteAppointment(appointmentId);
        }
        Long businessId = appointment.getBusinessId();

        Map<CalendarProvider, Future<String>> pending = new EnumMap<>(CalendarProvider.class);
        for (CalendarProviderAdapter adapter : adapters.all()) {
            if (!isConnected(adapter, businessId)) {
                continue;
            }
            pending.put(adapter.provider(), syncExecutor.submit(() -> adapter.syncAppointment(businessId, appointment)));
        }
        if (pending.isEmpty()) {
            log.debug("No calendars connected for business {}; appointment {} not synced", businessId, appointmentId);
            return new SyncResult(appointmentId, Map.of());
        }

        Map<CalendarProvider, String> eventIds = await(pending, "sync", appointmentId);

        Map<CalendarProvider, Boolean> results = new EnumMap<>(CalendarProvider.class);
        eventIds.forEach((provider, id) -> results.put(provider, StringUtils.isNotBlank(id)));
        if (results.containsValue(Boolean.TRUE)) {
            writeBack(appointmentId, a -> {
                eventIds.forEach((provider, id) -> {
                    if (StringUtils.isNotBlank(id)) {
                        provider.assignEventId(a, id);
                    }
                });
                a.setLastSyncedAt(clock.instant());
            });
        }
        SyncResult result = new SyncResult(appointmentId, results);
        log.info("Calendar sync for appointment {}: {}", appointmentId, result.results());
        return result;
    }

    /**
     * Runs {@link #syncAppointment(Long)} off the caller's thread. Cancelling the returned future
     * interrupts the fan-out and cancels outstanding provider calls.
     */
    public CompletableFuture<SyncResult> syncAppointmentInBackground(Long appointmentId) {
        CompletableFuture<SyncResult> result = new CompletableFuture<>();
        Future<?> task = dispatchExecutor.submit(() -> {
            try {
                result.complete(syncAppointment(appointmentId));
            } catch (RuntimeException e) {
                log.error("Background calendar sync failed for appointment {}: {}", appointmentId, e.getMessage(), e);
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((r, ex) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    /**
     * Removes the appointment's events from every provider that holds one and clears the ids that were removed.
     */
    public SyncResult deleteAppointment(Long appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        Long businessId = appointment.getBusinessId();

        Map<CalendarProvider, Future<Boolean>> pending = new EnumMap<>(CalendarProvider.class);
        for (CalendarProviderAdapter adapter : adapters.all()) {
            String eventId = adapter.provider().eventIdOf(appointment);
            if (StringUtils.isBlank(eventId)) {
                continue;
            }
            pending.put(adapter.provider(), syncExecutor.submit(() -> adapter.deleteAppointment(businessId, eventId)));
        }
        if (pending.isEmpty()) {
            return new SyncResult(appointmentId, Map.of());
        }

        Map<CalendarProvider, Boolean> results = new EnumMap<>(CalendarProvider.class);
        await(pending, "delete", appointmentId).forEach((provider, ok) -> results.put(provider, Boolean.TRUE.equals(ok)));
        if (results.containsValue(Boolean.TRUE)) {
            writeBack(appointmentId, a -> results.forEach((provider, ok) -> {
                if (ok) {
                    provider.assignEventId(a, null);
                }
            }));
        }
        SyncResult result = new SyncResult(appointmentId, results);
        log.info("Calendar delete for appointment {}: {}", appointmentId, result.results());
        return result;
    }

    public IntegrationStatus getIntegrationStatus(Long businessId) {
        return new IntegrationStatus(
                isConnected(adapters.get(CalendarProvider.GOOGLE), businessId),
                isConnected(adapters.get(CalendarProvider.MICROSOFT), businessId),
                isConnected(adapters.get(CalendarProvider.APPLE), businessId));
    }

    private boolean isConnected(CalendarProviderAdapter adapter, Long businessId) {
        try {
            return adapter.isConnected(businessId);
        } catch (RuntimeException e) {
            log.warn("Could not check {} connection for business {}: {}", adapter.provider().code(), businessId, e.getMessage());
            return false;
        }
    }

    /**
     * Collects results against one deadline. Timed out calls are cancelled and left out of the map;
     * failed calls map to null. On interrupt every outstanding call is cancelled.
     */
    private <T> Map<CalendarProvider, T> await(Map<CalendarProvider, Future<T>> pending, String operation, Long appointmentId) {
        Map<CalendarProvider, T> done = new EnumMap<>(CalendarProvider.class);
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Map.Entry<CalendarProvider, Future<T>> entry : pending.entrySet()) {
            CalendarProvider provider = entry.getKey();
            Future<T> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                done.put(provider, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} {} timed out after {} for appointment {}", provider.code(), operation, timeout, appointmentId);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("{} {} failed for appointment {}: {}", provider.code(), operation, appointmentId, cause.getMessage());
                done.put(provider, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                log.warn("Calendar {} for appointment {} interrupted; outstanding provider calls cancelled", operation, appointmentId);
                break;
            }
        }
        return done;
    }

    private void writeBack(Long appointmentId, Consumer<Appointment> change) {
        transactions.executeWithoutResult(status -> appointmentRepository.findById(appointmentId).ifPresent(a -> {
            change.accept(a);
            appointmentRepository.save(a);
        }));
    }
}
