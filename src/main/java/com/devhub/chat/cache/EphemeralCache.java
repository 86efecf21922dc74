package com.devhub.chat.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Short-lived key-value state shared by all connections: recent-message buffers
 * and rate-limit counters. Never the source of truth for anything.
 */
public interface EphemeralCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomically increments the counter at {@code key}. The expiry is set when the
     * counter is created and is not extended by later increments.
     *
     * @return the value after the increment
     */
    long incrementWithExpiry(String key, Duration ttl);

    /**
     * Appends to the list at {@code key}, dropping the oldest entries beyond
     * {@code maxLength}, and refreshes the list's expiry.
     */
    void appendToList(String key, String value, int maxLength, Duration ttl);

    /** The whole list, oldest first; empty when absent or expired. */
    List<String> listRange(String key);

    /** Replaces the list at {@code key}. */
    void replaceList(String key, List<String> values, Duration ttl);
}
