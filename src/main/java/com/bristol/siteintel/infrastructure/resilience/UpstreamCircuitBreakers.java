package com.bristol.siteintel.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Lazily creates one breaker per upstream id in the shared resilience4j registry.
 */
public class UpstreamCircuitBreakers {

    private final ConcurrentMap<String, UpstreamCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerRegistry registry;
    private final Function<String, CircuitBreakerSettings> settingsResolver;

    public UpstreamCircuitBreakers(CircuitBreakerRegistry registry,
                                   Function<String, CircuitBreakerSettings> settingsResolver) {
        this.registry = registry;
        this.settingsResolver = settingsResolver;
    }

    public UpstreamCircuitBreakers(Function<String, CircuitBreakerSettings> settingsResolver) {
        this(CircuitBreakerRegistry.ofDefaults(), settingsResolver);
    }

    public UpstreamCircuitBreakers() {
        this(upstreamId -> CircuitBreakerSettings.DEFAULT);
    }

    public UpstreamCircuitBreaker breakerFor(String upstreamId) {
        return breakers.computeIfAbsent(upstreamId, id -> {
            var settings = settingsResolver.apply(id);
            return new UpstreamCircuitBreaker(registry.circuitBreaker(id, settings.toConfig()), settings);
        });
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(UpstreamCircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::upstreamId))
                .toList();
    }
}
