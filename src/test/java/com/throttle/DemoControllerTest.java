package com.throttle;

import com.throttle.algorithms.FixedWindowRateLimiter;
import com.throttle.core.ThrottleConfig;
import com.throttle.storage.Cache;
import com.throttle.storage.CaffeineCache;
import com.throttle.storage.FakeTicker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class DemoControllerTest {
    
    private FakeTicker ticker;
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        CaffeineCache cache = new CaffeineCache(1_000, ticker);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        
        FixedWindowRateLimiter api = new FixedWindowRateLimiter(cache,
                ThrottleConfig.builder().limit(2).window(Duration.ofSeconds(60)).keyPrefix("api_").build(),
                registry);
        FixedWindowRateLimiter login = new FixedWindowRateLimiter(cache,
                ThrottleConfig.builder().limit(1).window(Duration.ofSeconds(30)).keyPrefix("login_").build(),
                registry);
        
        mockMvc = MockMvcBuilders.standaloneSetup(new DemoController(api, login, cache)).build();
    }
    
    @Test
    @DisplayName("Should answer 429 with Retry-After once the client IP is over the limit")
    void throttlesByClientIp() throws Exception {
        mockMvc.perform(get("/api/data").with(r -> { r.setRemoteAddr("10.1.1.1"); return r; }))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(1));
        mockMvc.perform(get("/api/data").with(r -> { r.setRemoteAddr("10.1.1.1"); return r; }))
                .andExpect(status().isOk());
        
        ticker.advance(Duration.ofMillis(10_500));
        
        mockMvc.perform(get("/api/data").with(r -> { r.setRemoteAddr("10.1.1.1"); return r; }))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "50"));
        
        // Another client is unaffected
        mockMvc.perform(get("/api/data").with(r -> { r.setRemoteAddr("10.1.1.2"); return r; }))
                .andExpect(status().isOk());
    }
    
    @Test
    @DisplayName("Admin reset lets a blocked client through again")
    void resetUnblocks() throws Exception {
        String body = "{\"username\":\"alice\"}";
        
        mockMvc.perform(post("/api/login").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/login").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "30"));
        
        mockMvc.perform(delete("/api/admin/reset/127.0.0.1"))
                .andExpect(status().isOk());
        
        mockMvc.perform(post("/api/login").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
    }
    
    @Test
    @DisplayName("Health is never throttled")
    void healthNotThrottled() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/api/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.cache").value("UP"));
        }
    }
    
    @Test
    @DisplayName("Health reports DOWN when the cache is unreachable")
    void healthDownWhenCacheUnavailable() throws Exception {
        Cache downCache = mock(Cache.class);
        when(downCache.isAvailable()).thenReturn(false);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                downCache, ThrottleConfig.perMinute(1), new SimpleMeterRegistry());
        MockMvc downMvc = MockMvcBuilders
                .standaloneSetup(new DemoController(limiter, limiter, downCache))
                .build();
        
        downMvc.perform(get("/api/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.cache").value("DOWN"));
    }
    
    @Test
    @DisplayName("Retry-After rounds partial seconds up")
    void wholeSecondsRoundUp() {
        assertEquals(0, DemoController.toWholeSeconds(Duration.ZERO));
        assertEquals(2, DemoController.toWholeSeconds(Duration.ofMillis(1_001)));
        assertEquals(30, DemoController.toWholeSeconds(Duration.ofSeconds(30)));
    }
}
