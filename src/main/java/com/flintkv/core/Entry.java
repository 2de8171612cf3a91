package com.flintkv.core;

import java.util.Objects;

/**
 * Immutable keyspace entry.
 * Holds the stored string together with its absolute expiry time.
 */
public final class Entry {

    private final String value;
    private final long expiresAt; // 0 means no expiration

    /**
     * Create an entry that never expires.
     *
     * @param value the stored value
     */
    public Entry(String value) {
        this(value, 0);
    }

    /**
     * Create an entry with an absolute expiry.
     *
     * @param value     the stored value
     * @param expiresAt expiration timestamp in epoch millis (0 for no expiration)
     */
    public Entry(String value, long expiresAt) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        if (expiresAt < 0) {
            throw new IllegalArgumentException("expiresAt must be non-negative, got: " + expiresAt);
        }
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get the expiration timestamp.
     *
     * @return expiration timestamp, or 0 if no expiration
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    /**
     * Check if this entry has expired at the given instant.
     * An entry whose expiry equals {@code nowMillis} is already expired.
     *
     * @param nowMillis current time in epoch millis
     * @return true if expired
     */
    public boolean isExpiredAt(long nowMillis) {
        return expiresAt > 0 && expiresAt <= nowMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry that = (Entry) o;
        return expiresAt == that.expiresAt && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, expiresAt);
    }

    @Override
    public String toString() {
        return "Entry{" +
               "valueLength=" + value.length() +
               ", expiresAt=" + expiresAt +
               '}';
    }
}
