package com.throttle.core;

import java.time.Duration;

/**
 * Rate limiting operations keyed by client identity.
 * Meant to sit at a request-handling boundary (controller, filter).
 */
public interface RateLimiter {
    
    /**
     * Check the identity's window and, if it still has room, record the attempt.
     * Returns immediately without blocking.
     *
     * @param identity subject being limited (ip address, user id, api key)
     * @return true if the attempt was admitted, false if the limit is reached
     */
    boolean tryAcquire(String identity);
    
    /**
     * Attempts left in the identity's current window.
     */
    long getAvailablePermits(String identity);
    
    /**
     * How long a blocked identity has to wait.
     *
     * @return {@link Duration#ZERO} if the identity may proceed now
     */
    Duration getRetryAfter(String identity);
    
    /**
     * Clear the identity's window.
     * Use carefully - mainly for testing or admin overrides.
     */
    void reset(String identity);
}
