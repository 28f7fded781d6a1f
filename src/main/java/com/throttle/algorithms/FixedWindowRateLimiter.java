package com.throttle.algorithms;

import com.throttle.core.RateLimiter;
import com.throttle.core.Throttle;
import com.throttle.core.ThrottleConfig;
import com.throttle.storage.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed window counter implementation.
 *
 * How it works:
 * - The first attempt of an identity opens a window of {@code window} length
 * - Each admitted attempt increments the identity's count
 * - Once the count reaches {@code limit}, attempts are rejected until the
 *   cache expires the entry and the next attempt opens a fresh window
 *
 * Example: 5 attempts/min, first attempt at 12:00:10
 * - attempts at 12:00:10..12:00:40 fill the window
 * - everything is rejected until 12:01:10, whatever happens in between
 *
 * Trade-off: a client can squeeze nearly twice the limit through a window
 * boundary, in exchange for one counter per identity.
 *
 * Check and record are two separate cache round trips, so concurrent
 * attempts for the same identity may overshoot the limit.
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {
    
    private final Cache cache;
    private final ThrottleConfig config;
    
    // Metrics
    private final Counter allowedRequests;
    private final Counter rejectedRequests;
    private final Counter resets;
    
    public FixedWindowRateLimiter(
            Cache cache,
            ThrottleConfig config,
            MeterRegistry meterRegistry) {
        
        config.validate();
        this.cache = cache;
        this.config = config;
        
        this.allowedRequests = Counter.builder("throttle.requests.allowed")
                .description("Number of admitted attempts")
                .tag("prefix", config.getKeyPrefix())
                .register(meterRegistry);
        
        this.rejectedRequests = Counter.builder("throttle.requests.rejected")
                .description("Number of rejected attempts")
                .tag("prefix", config.getKeyPrefix())
                .register(meterRegistry);
        
        this.resets = Counter.builder("throttle.resets")
                .description("Number of cleared windows")
                .tag("prefix", config.getKeyPrefix())
                .register(meterRegistry);
        
        log.info("FixedWindow initialized: prefix={}, limit={}, window={}",
                config.getKeyPrefix(), config.getLimit(), config.getWindow());
    }
    
    @Override
    public boolean tryAcquire(String identity) {
        Throttle throttle = config.forIdentity(identity);
        
        if (!throttle.canGo(cache)) {
            rejectedRequests.increment();
            return false;
        }
        
        throttle.hit(cache);
        allowedRequests.increment();
        return true;
    }
    
    @Override
    public long getAvailablePermits(String identity) {
        long attempts = config.forIdentity(identity).attempts(cache);
        return Math.max(0, config.getLimit() - attempts);
    }
    
    @Override
    public Duration getRetryAfter(String identity) {
        Throttle throttle = config.forIdentity(identity);
        return throttle.canGo(cache) ? Duration.ZERO : throttle.getExpire(cache);
    }
    
    @Override
    public void reset(String identity) {
        config.forIdentity(identity).remove(cache);
        resets.increment();
        log.debug("Reset throttle for identity: {}", identity);
    }
}
