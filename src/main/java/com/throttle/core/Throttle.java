package com.throttle.core;

import com.throttle.storage.Cache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed-window attempt counter for one identity (typically a client IP).
 *
 * The throttle holds configuration only; the count lives in the {@link Cache}
 * passed to each call under {@code keyPrefix + identity}. A window starts with
 * the first {@link #hit} and ends when the cache expires the entry, so a client
 * may get up to {@code 2 * limit - 1} attempts across a window boundary.
 *
 * <pre>
 * Throttle throttle = new Throttle(ip, 5, Duration.ofMinutes(1), "login_");
 * if (throttle.canGo(cache)) {
 *     throttle.hit(cache);
 *     // handle the request
 * }
 * </pre>
 *
 * Nothing here is atomic: two callers hitting the same identity at once can
 * both read {@code n} and both write {@code n + 1}.
 */
@Slf4j
@Value
public class Throttle {
    
    /**
     * Subject being throttled, only used to build the key
     */
    String identity;
    
    /**
     * Attempts allowed inside one window
     */
    long limit;
    
    /**
     * Lifetime of a window, counted from its first hit
     */
    Duration window;
    
    /**
     * Namespace for the cache key
     */
    String keyPrefix;
    
    public String key() {
        return keyPrefix + identity;
    }
    
    /**
     * @return true while fewer than {@code limit} attempts are recorded
     */
    public boolean canGo(Cache cache) {
        return attempts(cache) < limit;
    }
    
    /**
     * Attempts recorded in the current window, 0 if there is none.
     */
    public long attempts(Cache cache) {
        return cache.get(key()).orElse(0L);
    }
    
    /**
     * Time left in the current window, or the full {@code window} when the
     * cache has no expiry for the key.
     */
    public Duration getExpire(Cache cache) {
        return cache.expire(key()).orElse(window);
    }
    
    /**
     * Records one attempt. The entry is rewritten with the time the window had
     * left before this call, so hits never push the window end forward.
     *
     * @throws com.throttle.storage.CacheException if the cache write fails
     */
    public void hit(Cache cache) {
        String key = key();
        Duration expire = getExpire(cache);
        long count = cache.get(key).orElse(0L) + 1;
        
        cache.set(key, count, expire);
        log.trace("Hit {}: count={}, expiresIn={}", key, count, expire);
    }
    
    /**
     * Forgets every attempt of this identity.
     *
     * @throws com.throttle.storage.CacheException if the cache delete fails
     */
    public void remove(Cache cache) {
        cache.remove(key());
    }
}
