package com.bristol.siteintel.infrastructure.config;

import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.infrastructure.cache.CacheProperties;
import com.bristol.siteintel.infrastructure.cache.CaffeineResponseCache;
import com.bristol.siteintel.infrastructure.cache.ResponseCache;
import com.bristol.siteintel.infrastructure.resilience.FailureClassifier;
import com.bristol.siteintel.infrastructure.resilience.RetryExecutor;
import com.bristol.siteintel.infrastructure.resilience.UpstreamCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCache<MetricResult> responseCache(Clock clock, CacheProperties cacheProperties) {
        return new CaffeineResponseCache<>(clock, cacheProperties.getStaleRetention(), cacheProperties.getMaximumSize());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public UpstreamCircuitBreakers upstreamCircuitBreakers(CircuitBreakerRegistry circuitBreakerRegistry,
                                                           UpstreamProperties properties) {
        return new UpstreamCircuitBreakers(circuitBreakerRegistry, properties::breakerSettings);
    }

    @Bean
    public RetryExecutor retryExecutor(UpstreamCircuitBreakers upstreamCircuitBreakers,
                                       @Qualifier("upstreamExecutor") Executor upstreamExecutor) {
        return new RetryExecutor(upstreamCircuitBreakers, new FailureClassifier(), upstreamExecutor);
    }

    @Bean(name = "upstreamExecutor")
    public Executor upstreamExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("upstream-");
        executor.initialize();
        return executor;
    }
}
