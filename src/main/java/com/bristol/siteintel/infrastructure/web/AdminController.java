package com.bristol.siteintel.infrastructure.web;

import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.infrastructure.cache.ResponseCache;
import com.bristol.siteintel.infrastructure.cache.ResponseCacheStats;
import com.bristol.siteintel.infrastructure.resilience.CircuitBreakerSnapshot;
import com.bristol.siteintel.infrastructure.resilience.UpstreamCircuitBreakers;
import com.bristol.siteintel.infrastructure.web.dto.CacheClearResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final ResponseCache<MetricResult> cache;
    private final UpstreamCircuitBreakers circuitBreakers;

    public AdminController(ResponseCache<MetricResult> cache, UpstreamCircuitBreakers circuitBreakers) {
        this.cache = cache;
        this.circuitBreakers = circuitBreakers;
    }

    @DeleteMapping("/cache")
    public ResponseEntity<CacheClearResponse> clearCache(@RequestParam(required = false) String prefix) {
        logger.info("Clearing cache{}", prefix == null || prefix.isEmpty() ? "" : " with prefix '" + prefix + "'");
        int removed = cache.clear(prefix);
        return ResponseEntity.ok(new CacheClearResponse(prefix, removed));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<ResponseCacheStats> cacheStats() {
        return ResponseEntity.ok(cache.getStats());
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<List<CircuitBreakerSnapshot>> circuitBreakers() {
        return ResponseEntity.ok(circuitBreakers.snapshots());
    }
}
