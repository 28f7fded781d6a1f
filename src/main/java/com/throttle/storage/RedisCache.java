package com.throttle.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Redis-backed cache.
 * Counts are stored as decimal strings with a millisecond TTL ({@code SET PX}),
 * remaining TTL is read with {@code PTTL}.
 *
 * Writes and deletes that still fail after the retries surface as
 * {@link CacheException}. Reads fail open: an unreachable Redis, or a value
 * that is not a count, reads as a missing key.
 */
@Slf4j
public class RedisCache implements Cache, AutoCloseable {
    
    private static final int MAX_RETRIES = 3;
    private static final long RETRY_DELAY_MS = 10;
    
    private final JedisPool jedisPool;
    
    public RedisCache(String host, int port) {
        this(host, port, Protocol.DEFAULT_DATABASE);
    }
    
    public RedisCache(String host, int port, int database) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(16);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(2000));
        
        this.jedisPool = new JedisPool(poolConfig, host, port, Protocol.DEFAULT_TIMEOUT, null, database);
        log.info("Redis cache initialized: {}:{} db={}", host, port, database);
    }
    
    @Override
    public OptionalLong get(String key) {
        String raw;
        try {
            raw = executeWithRetry(() -> {
                try (var jedis = jedisPool.getResource()) {
                    return jedis.get(key);
                }
            });
        } catch (CacheException e) {
            log.warn("Reading {} failed, treating as missing", key, e);
            return OptionalLong.empty();
        }
        
        return toCount(key, raw);
    }
    
    @Override
    public void set(String key, long value, Duration ttl) {
        long ttlMs = ttl.toMillis();
        if (ttlMs <= 0) {
            // Redis rejects PX 0; an entry with no time left is simply gone
            remove(key);
            return;
        }
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.set(key, String.valueOf(value), new SetParams().px(ttlMs));
                return null;
            }
        });
    }
    
    @Override
    public Optional<Duration> expire(String key) {
        long pttl;
        try {
            pttl = executeWithRetry(() -> {
                try (var jedis = jedisPool.getResource()) {
                    return jedis.pttl(key);
                }
            });
        } catch (CacheException e) {
            log.warn("Reading TTL of {} failed, treating as missing", key, e);
            return Optional.empty();
        }
        
        return toRemaining(pttl);
    }
    
    /**
     * A value that is not a count reads as a missing key.
     */
    static OptionalLong toCount(String key, String raw) {
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Value at {} is not a count, treating as missing: {}", key, raw);
            return OptionalLong.empty();
        }
    }
    
    /**
     * Maps a PTTL reply to the remaining time-to-live.
     * -2: no such key, -1: no expiry, 0: expiring right now
     */
    static Optional<Duration> toRemaining(long pttl) {
        if (pttl <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(pttl));
    }
    
    @Override
    public void remove(String key) {
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.del(key);
                return null;
            }
        });
    }
    
    /**
     * Flushes the selected Redis database, not just throttle keys.
     */
    @Override
    public void clear() {
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.flushDB();
                return null;
            }
        });
    }
    
    @Override
    public boolean isAvailable() {
        try (var jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }
    
    /**
     * Simple retry wrapper for transient connection failures
     */
    private <T> T executeWithRetry(CacheOperation<T> operation) {
        Exception lastException = null;
        
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return operation.execute();
            } catch (Exception e) {
                lastException = e;
                log.warn("Cache operation failed (attempt {}/{}): {}",
                        i + 1, MAX_RETRIES, e.getMessage());
                
                if (i < MAX_RETRIES - 1) {
                    try {
                        Thread.sleep(RETRY_DELAY_MS * (i + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        
        throw new CacheException("Operation failed after " + MAX_RETRIES + " retries", lastException);
    }
    
    @FunctionalInterface
    private interface CacheOperation<T> {
        T execute() throws Exception;
    }
    
    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
