package com.throttle.storage;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * In-process cache on top of Caffeine.
 *
 * Every entry carries its own TTL, written through Caffeine's variable
 * expiration policy. Reads and rewrites of the value leave the remaining
 * time untouched unless the caller supplies a new TTL.
 *
 * The cache is bounded ({@code throttle.cache.maximum-size}). Once it is full,
 * Caffeine evicts entries before their TTL runs out, and an evicted identity
 * starts over with a fresh window even if it was blocked. Size it above the
 * number of identities expected within one window.
 */
@Slf4j
public class CaffeineCache implements Cache {
    
    public static final long DEFAULT_MAXIMUM_SIZE = 100_000;
    
    private final com.github.benmanes.caffeine.cache.Cache<String, Long> cache;
    private final Policy.VarExpiration<String, Long> expiration;
    
    public CaffeineCache() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }
    
    public CaffeineCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }
    
    /**
     * @param ticker time source for expiry, replaceable in tests
     */
    public CaffeineCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new KeepRemaining())
                .build();
        this.expiration = cache.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("Variable expiration not enabled"));
        
        log.info("Caffeine cache initialized: maximumSize={}", maximumSize);
    }
    
    @Override
    public OptionalLong get(String key) {
        Long value = cache.getIfPresent(key);
        return value != null ? OptionalLong.of(value) : OptionalLong.empty();
    }
    
    @Override
    public void set(String key, long value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            cache.invalidate(key);
            return;
        }
        try {
            expiration.put(key, value, ttl);
        } catch (RuntimeException e) {
            throw new CacheException("Failed to write " + key, e);
        }
    }
    
    @Override
    public Optional<Duration> expire(String key) {
        return expiration.getExpiresAfter(key);
    }
    
    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }
    
    @Override
    public void clear() {
        cache.invalidateAll();
    }
    
    @Override
    public boolean isAvailable() {
        return true;
    }
    
    /**
     * Entries are only ever written with an explicit TTL, so creation without
     * one means "never expires" and reads/updates keep whatever time is left.
     */
    private static final class KeepRemaining implements Expiry<String, Long> {
        
        @Override
        public long expireAfterCreate(String key, Long value, long currentTime) {
            return Long.MAX_VALUE;
        }
        
        @Override
        public long expireAfterUpdate(String key, Long value, long currentTime, long currentDuration) {
            return currentDuration;
        }
        
        @Override
        public long expireAfterRead(String key, Long value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
