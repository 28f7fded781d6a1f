package com.throttle.config;

import com.throttle.algorithms.FixedWindowRateLimiter;
import com.throttle.core.RateLimiter;
import com.throttle.core.ThrottleConfig;
import com.throttle.storage.Cache;
import com.throttle.storage.CaffeineCache;
import com.throttle.storage.RedisCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring configuration for throttle components
 */
@Slf4j
@Configuration
public class ThrottleConfiguration {
    
    @Value("${throttle.cache:memory}")
    private String cacheType;
    
    @Value("${throttle.cache.maximum-size:100000}")
    private long maximumSize;
    
    @Value("${redis.host:localhost}")
    private String redisHost;
    
    @Value("${redis.port:6379}")
    private int redisPort;
    
    @Bean
    public Cache throttleCache() {
        switch (cacheType.toLowerCase()) {
            case "redis":
                log.info("Initializing Redis throttle cache at {}:{}", redisHost, redisPort);
                return new RedisCache(redisHost, redisPort);
            case "memory":
                log.info("Initializing in-memory throttle cache, maximumSize={}", maximumSize);
                return new CaffeineCache(maximumSize);
            default:
                throw new IllegalArgumentException("Unknown throttle.cache: " + cacheType);
        }
    }
    
    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
    
    /**
     * General API throttle, 100 requests per minute by default
     */
    @Bean(name = "apiRateLimiter")
    public RateLimiter apiRateLimiter(
            Cache cache,
            MeterRegistry meterRegistry,
            @Value("${throttle.api.limit:100}") long limit,
            @Value("${throttle.api.window-seconds:60}") long windowSeconds) {
        
        ThrottleConfig config = ThrottleConfig.builder()
                .limit(limit)
                .window(Duration.ofSeconds(windowSeconds))
                .keyPrefix("api_rate_limit_")
                .build();
        
        return new FixedWindowRateLimiter(cache, config, meterRegistry);
    }
    
    /**
     * Stricter throttle for login attempts, 5 per minute by default
     */
    @Bean(name = "loginRateLimiter")
    public RateLimiter loginRateLimiter(
            Cache cache,
            MeterRegistry meterRegistry,
            @Value("${throttle.login.limit:5}") long limit,
            @Value("${throttle.login.window-seconds:60}") long windowSeconds) {
        
        ThrottleConfig config = ThrottleConfig.builder()
                .limit(limit)
                .window(Duration.ofSeconds(windowSeconds))
                .keyPrefix("login_throttle_")
                .build();
        
        return new FixedWindowRateLimiter(cache, config, meterRegistry);
    }
}
