package com.flintkv.core;

import java.util.Optional;

/**
 * Keyspace storage interface.
 * All implementations must be thread-safe.
 */
public interface KVStore {

    /**
     * Store a value with the given key, replacing any previous entry
     * together with its expiry.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param ttlMillis time-to-live in milliseconds (0 for no expiration)
     */
    void set(String key, String value, long ttlMillis);

    /**
     * Retrieve the entry for a given key.
     * An entry found past its expiry is removed before this method returns.
     *
     * @param key the key to look up
     * @return the entry if found and not expired, empty otherwise
     */
    Optional<Entry> get(String key);

    /**
     * Delete an entry.
     *
     * @param key the key to delete
     * @return the deleted entry if one existed, empty otherwise
     */
    Optional<Entry> delete(String key);

    /**
     * Get the number of live entries.
     *
     * @return the number of non-expired entries
     */
    int size();
}
