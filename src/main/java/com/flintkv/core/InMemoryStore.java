package com.flintkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Thread-safe in-memory keyspace backed by ConcurrentHashMap.
 * Expired entries are evicted lazily, on the first lookup that observes them.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    private final ConcurrentHashMap<String, Entry> store;
    private final LongSupplier clock;
    private final AtomicLong expiredEvictions;

    /**
     * Create a store driven by the system wall clock.
     */
    public InMemoryStore() {
        this(System::currentTimeMillis);
    }

    /**
     * Create a store with a custom clock.
     *
     * @param clock supplier of the current time in epoch millis
     */
    public InMemoryStore(LongSupplier clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = new ConcurrentHashMap<>();
        this.clock = clock;
        this.expiredEvictions = new AtomicLong(0);
    }

    @Override
    public void set(String key, String value, long ttlMillis) {
        validateKey(key);
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("ttlMillis must be non-negative, got: " + ttlMillis);
        }

        long expiresAt = ttlMillis > 0 ? expiryFor(ttlMillis) : 0;
        Entry previous = store.put(key, new Entry(value, expiresAt));

        logger.trace("SET key={}, valueLength={}, ttl={}, replaced={}",
                key, value.length(), ttlMillis, previous != null);
    }

    @Override
    public Optional<Entry> get(String key) {
        validateKey(key);
        Entry entry = store.get(key);
        if (entry == null) {
            logger.trace("GET key={} -> NOT_FOUND", key);
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.getAsLong())) {
            // Conditional remove: a concurrent SET of a fresh entry must survive,
            // and only one of several racing readers gets to evict
            if (store.remove(key, entry)) {
                expiredEvictions.incrementAndGet();
                logger.trace("GET key={} -> EXPIRED (evicted)", key);
            }
            return Optional.empty();
        }
        logger.trace("GET key={} -> FOUND", key);
        return Optional.of(entry);
    }

    @Override
    public Optional<Entry> delete(String key) {
        validateKey(key);
        Entry removed = store.remove(key);
        logger.trace("DELETE key={} -> {}", key, removed != null ? "DELETED" : "NOT_FOUND");
        return Optional.ofNullable(removed);
    }

    @Override
    public int size() {
        long now = clock.getAsLong();
        return (int) store.values().stream()
                .filter(e -> !e.isExpiredAt(now))
                .count();
    }

    /**
     * Get raw entry count including expired but not yet evicted entries.
     */
    public int rawSize() {
        return store.size();
    }

    /**
     * Number of entries removed because a lookup found them expired.
     */
    public long getExpiredEvictions() {
        return expiredEvictions.get();
    }

    /**
     * Absolute expiry for a TTL counted from now, saturating at {@code Long.MAX_VALUE}.
     */
    private long expiryFor(long ttlMillis) {
        long now = clock.getAsLong();
        return ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
    }

    private void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }
}
