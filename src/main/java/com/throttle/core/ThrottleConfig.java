package com.throttle.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Throttling policy shared by every identity of one rate limiter.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class ThrottleConfig {
    
    public static final String DEFAULT_KEY_PREFIX = "throttle_";
    
    /**
     * Maximum number of attempts allowed in the window.
     * Zero blocks everything.
     */
    long limit;
    
    /**
     * Fixed window duration, anchored at the first attempt
     */
    Duration window;
    
    /**
     * Prefix keeping throttle keys apart from other cache entries
     */
    @Builder.Default
    String keyPrefix = DEFAULT_KEY_PREFIX;
    
    public void validate() {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
        if (keyPrefix == null) {
            throw new IllegalArgumentException("keyPrefix is required");
        }
    }
    
    public Throttle forIdentity(String identity) {
        return new Throttle(identity, limit, window, keyPrefix);
    }
    
    public static ThrottleConfig perSecond(long limit) {
        return ThrottleConfig.builder()
                .limit(limit)
                .window(Duration.ofSeconds(1))
                .build();
    }
    
    public static ThrottleConfig perMinute(long limit) {
        return ThrottleConfig.builder()
                .limit(limit)
                .window(Duration.ofMinutes(1))
                .build();
    }
    
    public static ThrottleConfig perHour(long limit) {
        return ThrottleConfig.builder()
                .limit(limit)
                .window(Duration.ofHours(1))
                .build();
    }
}
