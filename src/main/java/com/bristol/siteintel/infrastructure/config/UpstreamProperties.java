package com.bristol.siteintel.infrastructure.config;

import com.bristol.siteintel.infrastructure.resilience.CircuitBreakerSettings;
import com.bristol.siteintel.infrastructure.resilience.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-upstream connection, caching and resilience settings, bound from {@code siteintel.upstream.<id>.*}.
 * Retry and breaker values not set for an upstream fall back to the defaults.
 */
@Component
@ConfigurationProperties(prefix = "siteintel")
public class UpstreamProperties {

    private Map<String, Upstream> upstream = new LinkedHashMap<>();

    /**
     * Overall budget for one inbound metric request
     */
    private Duration requestDeadline = Duration.ofSeconds(60);

    private Duration defaultCacheTtl = Duration.ofMinutes(10);

    public Upstream instance(String upstreamId) {
        return upstream.getOrDefault(upstreamId, new Upstream());
    }

    public String baseUrl(String upstreamId) {
        var baseUrl = instance(upstreamId).getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("No base-url configured for upstream '" + upstreamId + "'");
        }
        return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    public Duration cacheTtl(String upstreamId) {
        var ttl = instance(upstreamId).getCacheTtl();
        return ttl != null ? ttl : defaultCacheTtl;
    }

    public RetryPolicy retryPolicy(String upstreamId) {
        var retry = instance(upstreamId).getRetry();
        var defaults = RetryPolicy.DEFAULT;
        return new RetryPolicy(
                retry.getMaxAttempts() != null ? retry.getMaxAttempts() : defaults.maxAttempts(),
                retry.getBaseDelay() != null ? retry.getBaseDelay() : defaults.baseDelay(),
                retry.getMaxDelay() != null ? retry.getMaxDelay() : defaults.maxDelay(),
                retry.getPerAttemptTimeout() != null ? retry.getPerAttemptTimeout() : defaults.perAttemptTimeout());
    }

    public CircuitBreakerSettings breakerSettings(String upstreamId) {
        var breaker = instance(upstreamId).getBreaker();
        var defaults = CircuitBreakerSettings.DEFAULT;
        return new CircuitBreakerSettings(
                breaker.getFailureThreshold() != null ? breaker.getFailureThreshold() : defaults.failureThreshold(),
                breaker.getCooldown() != null ? breaker.getCooldown() : defaults.cooldown());
    }

    public Map<String, Upstream> getUpstream() {
        return upstream;
    }

    public void setUpstream(Map<String, Upstream> upstream) {
        this.upstream = upstream;
    }

    public Duration getRequestDeadline() {
        return requestDeadline;
    }

    public void setRequestDeadline(Duration requestDeadline) {
        this.requestDeadline = requestDeadline;
    }

    public Duration getDefaultCacheTtl() {
        return defaultCacheTtl;
    }

    public void setDefaultCacheTtl(Duration defaultCacheTtl) {
        this.defaultCacheTtl = defaultCacheTtl;
    }

    public static class Upstream {

        private String baseUrl;
        private String apiKey;
        private Duration cacheTtl;
        private Retry retry = new Retry();
        private Breaker breaker = new Breaker();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }

        public Breaker getBreaker() {
            return breaker;
        }

        public void setBreaker(Breaker breaker) {
            this.breaker = breaker;
        }
    }

    public static class Retry {

        private Integer maxAttempts;
        private Duration baseDelay;
        private Duration maxDelay;
        private Duration perAttemptTimeout;

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getPerAttemptTimeout() {
            return perAttemptTimeout;
        }

        public void setPerAttemptTimeout(Duration perAttemptTimeout) {
            this.perAttemptTimeout = perAttemptTimeout;
        }
    }

    public static class Breaker {

        private Integer failureThreshold;
        private Duration cooldown;

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }
}
