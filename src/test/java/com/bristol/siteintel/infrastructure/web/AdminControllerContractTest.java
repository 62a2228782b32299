package com.bristol.siteintel.infrastructure.web;

import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.infrastructure.cache.ResponseCache;
import com.bristol.siteintel.infrastructure.cache.ResponseCacheStats;
import com.bristol.siteintel.infrastructure.resilience.CircuitBreakerSnapshot;
import com.bristol.siteintel.infrastructure.resilience.UpstreamCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
class AdminControllerContractTest {

    private static final Instant OPENED_AT = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResponseCache<MetricResult> cache;

    @MockBean
    private UpstreamCircuitBreakers circuitBreakers;

    @Test
    void shouldClearCacheByPrefix() throws Exception {
        // Given
        when(cache.clear("bls:")).thenReturn(3);

        // When & Then
        mockMvc.perform(delete("/admin/cache").param("prefix", "bls:"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix", is("bls:")))
                .andExpect(jsonPath("$.removed", is(3)));
        verify(cache).clear("bls:");
    }

    @Test
    void shouldClearWholeCacheWithoutPrefix() throws Exception {
        // Given
        when(cache.clear(null)).thenReturn(7);

        // When & Then
        mockMvc.perform(delete("/admin/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed", is(7)));
    }

    @Test
    void shouldReportCacheStats() throws Exception {
        // Given
        when(cache.getStats()).thenReturn(new ResponseCacheStats(8, 2, 0.8, 1, 0, 4, 5));

        // When & Then
        mockMvc.perform(get("/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits", is(8)))
                .andExpect(jsonPath("$.misses", is(2)))
                .andExpect(jsonPath("$.hitRate", is(0.8)))
                .andExpect(jsonPath("$.activeEntries", is(4)));
    }

    @Test
    void shouldListCircuitBreakers() throws Exception {
        // Given
        when(circuitBreakers.snapshots()).thenReturn(List.of(
                new CircuitBreakerSnapshot("bls", State.CLOSED, 0, 0, 2, null, 5, Duration.ofMinutes(5)),
                new CircuitBreakerSnapshot("fbi", State.OPEN, 5, 5, 5, OPENED_AT, 5, Duration.ofMinutes(5))));

        // When & Then
        mockMvc.perform(get("/admin/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].upstreamId", is("fbi")))
                .andExpect(jsonPath("$[1].state", is("OPEN")))
                .andExpect(jsonPath("$[1].openedAt", is("2024-06-01T12:00:00Z")))
                .andExpect(jsonPath("$[1].consecutiveFailures", is(5)))
                .andExpect(jsonPath("$[1].failedCalls", is(5)))
                .andExpect(jsonPath("$[0].state", is("CLOSED")));
    }
}
