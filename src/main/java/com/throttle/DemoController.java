package com.throttle;

import com.throttle.core.RateLimiter;
import com.throttle.storage.Cache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Demo API controller throttling clients by IP address
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class DemoController {
    
    private final RateLimiter apiRateLimiter;
    private final RateLimiter loginRateLimiter;
    private final Cache cache;
    
    public DemoController(
            @Qualifier("apiRateLimiter") RateLimiter apiRateLimiter,
            @Qualifier("loginRateLimiter") RateLimiter loginRateLimiter,
            Cache cache) {
        
        this.apiRateLimiter = apiRateLimiter;
        this.loginRateLimiter = loginRateLimiter;
        this.cache = cache;
    }
    
    /**
     * Standard API endpoint
     */
    @GetMapping("/data")
    public ResponseEntity<Map<String, Object>> getData(HttpServletRequest request) {
        String ip = request.getRemoteAddr();
        
        if (!apiRateLimiter.tryAcquire(ip)) {
            return rateLimitExceeded(apiRateLimiter, ip);
        }
        
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Success!");
        response.put("remaining", apiRateLimiter.getAvailablePermits(ip));
        response.put("data", Map.of("timestamp", System.currentTimeMillis()));
        
        return ResponseEntity.ok(response);
    }
    
    /**
     * Login endpoint, throttled per client IP to slow down brute force
     */
    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(
            @RequestBody Map<String, String> credentials,
            HttpServletRequest request) {
        
        String ip = request.getRemoteAddr();
        
        if (!loginRateLimiter.tryAcquire(ip)) {
            log.warn("Too many login attempts from {} (user {})",
                    ip, credentials.getOrDefault("username", "unknown"));
            return rateLimitExceeded(loginRateLimiter, ip);
        }
        
        // Simulate auth logic
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Login successful");
        response.put("remaining_attempts", loginRateLimiter.getAvailablePermits(ip));
        
        return ResponseEntity.ok(response);
    }
    
    /**
     * Health check endpoint (not throttled), DOWN when the throttle cache is unreachable
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        boolean cacheUp = cache.isAvailable();
        
        Map<String, String> status = new HashMap<>();
        status.put("status", cacheUp ? "UP" : "DOWN");
        status.put("cache", cacheUp ? "UP" : "DOWN");
        status.put("timestamp", String.valueOf(System.currentTimeMillis()));
        
        if (!cacheUp) {
            log.warn("Health check: throttle cache unavailable");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(status);
        }
        return ResponseEntity.ok(status);
    }
    
    /**
     * Admin endpoint to clear every throttle of an identity
     */
    @DeleteMapping("/admin/reset/{identity}")
    public ResponseEntity<Map<String, String>> reset(@PathVariable String identity) {
        apiRateLimiter.reset(identity);
        loginRateLimiter.reset(identity);
        
        Map<String, String> response = new HashMap<>();
        response.put("message", "Throttles reset for: " + identity);
        return ResponseEntity.ok(response);
    }
    
    private ResponseEntity<Map<String, Object>> rateLimitExceeded(
            RateLimiter limiter, String identity) {
        
        Duration retryAfter = limiter.getRetryAfter(identity);
        long retryAfterSeconds = toWholeSeconds(retryAfter);
        
        Map<String, Object> error = new HashMap<>();
        error.put("error", "Rate limit exceeded");
        error.put("message", "Too many requests. Please try again later.");
        error.put("retry_after_seconds", retryAfterSeconds);
        
        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(error);
    }
    
    // Rounded up so a client never retries before the window ends
    static long toWholeSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
