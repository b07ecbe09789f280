package com.smallbiz.agent.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per (business, staff) pair. Check-then-insert for a booking runs while holding it,
 * so two callers can never both see a slot as free and both insert.
 * A lock is dropped once no thread holds or waits for it, so the map only contains pairs being booked right now.
 * Single application instance only; several instances would need a database level guard.
 */
@Component
public class BookingLockRegistry {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long businessId, Long staffId, Supplier<T> action) {
        String key = key(businessId, staffId);
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry held = existing != null ? existing : new Entry();
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    int size() {
        return locks.size();
    }

    static String key(Long businessId, Long staffId) {
        return businessId + ":" + (staffId != null ? staffId : "none");
    }

    // users is only read and written inside compute for its own key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
