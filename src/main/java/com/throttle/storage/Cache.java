package com.throttle.storage;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Key-value store with per-key expiration that throttles keep their counts in.
 * Allows swapping backends (in-process, Redis) without changing throttle logic.
 */
public interface Cache {
    
    /**
     * Get the stored count for a key
     *
     * @param key cache key
     * @return the count, or empty if the key is missing or expired
     */
    OptionalLong get(String key);
    
    /**
     * Store a value with the given time-to-live, overwriting any previous
     * value and TTL for the key.
     *
     * @throws CacheException if the write fails
     */
    void set(String key, long value, Duration ttl);
    
    /**
     * Remaining time-to-live for a key.
     *
     * @return empty if the key has no entry or no TTL recorded
     */
    Optional<Duration> expire(String key);
    
    /**
     * Delete a key. No-op when the key is absent.
     *
     * @throws CacheException if the delete fails
     */
    void remove(String key);
    
    /**
     * Drop every entry
     */
    void clear();
    
    /**
     * Health check
     */
    boolean isAvailable();
}
