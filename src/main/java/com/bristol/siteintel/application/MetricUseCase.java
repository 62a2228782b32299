package com.bristol.siteintel.application;

import com.bristol.siteintel.domain.exception.CircuitOpenException;
import com.bristol.siteintel.domain.exception.DeadlineExceededException;
import com.bristol.siteintel.domain.exception.ErrorCode;
import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.exception.RetriesExhaustedException;
import com.bristol.siteintel.domain.model.MetricOrigin;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.domain.port.out.UpstreamSource;
import com.bristol.siteintel.infrastructure.adapter.normalizer.NormalizerRegistry;
import com.bristol.siteintel.infrastructure.cache.CacheKey;
import com.bristol.siteintel.infrastructure.cache.ResponseCache;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import com.bristol.siteintel.infrastructure.resilience.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class MetricUseCase implements FindMetric {

    private static final Logger logger = LoggerFactory.getLogger(MetricUseCase.class);

    private final UpstreamSources sources;
    private final ResponseCache<MetricResult> cache;
    private final RetryExecutor retryExecutor;
    private final NormalizerRegistry normalizers;
    private final UpstreamProperties properties;
    private final Clock clock;

    public MetricUseCase(UpstreamSources sources,
                         ResponseCache<MetricResult> cache,
                         RetryExecutor retryExecutor,
                         NormalizerRegistry normalizers,
                         UpstreamProperties properties,
                         Clock clock) {
        this.sources = sources;
        this.cache = cache;
        this.retryExecutor = retryExecutor;
        this.normalizers = normalizers;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public MetricResult fetchMetric(String upstreamId, Map<String, String> params) {
        return fetchMetric(upstreamId, params, properties.getRequestDeadline());
    }

    @Override
    public MetricResult fetchMetric(String upstreamId, Map<String, String> params, Duration deadline) {
        var future = fetchMetricAsync(upstreamId, params);
        if (deadline != null) {
            future.orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS);
        }
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            var cause = ErrorCode.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new DeadlineExceededException(upstreamId, deadline, cause);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Unexpected failure fetching from upstream " + upstreamId, cause);
        }
    }

    @Override
    public CompletableFuture<MetricResult> fetchMetricAsync(String upstreamId, Map<String, String> params) {
        UpstreamSource source;
        MetricQuery query;
        try {
            source = sources.require(upstreamId);
            query = source.resolveQuery(params == null ? Map.of() : params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        var key = CacheKey.of(upstreamId, query.params());
        var cached = cache.get(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get().withOrigin(MetricOrigin.CACHED));
        }

        var upstream = retryExecutor.execute(upstreamId, properties.retryPolicy(upstreamId), () -> source.fetch(query));
        var result = upstream
                .thenApply(body -> {
                    var payload = normalizers.normalize(body, source.family(), query);
                    var fresh = MetricResult.fresh(upstreamId, source.family(), payload, clock.instant());
                    cache.put(key, fresh, properties.cacheTtl(upstreamId));
                    return fresh;
                })
                .exceptionally(error -> fallbackToStale(key, upstreamId, error));
        result.whenComplete((value, error) -> {
            if (error != null) {
                upstream.cancel(true);
            }
        });
        return result;
    }

    private MetricResult fallbackToStale(CacheKey key, String upstreamId, Throwable error) {
        var cause = ErrorCode.unwrap(error);
        if (cause instanceof CircuitOpenException || cause instanceof RetriesExhaustedException) {
            var stale = cache.getStale(key);
            if (stale.isPresent()) {
                logger.warn("Serving stale data for {} stored at {}: {}", key, stale.get().storedAt(), cause.getMessage());
                return stale.get().value().withOrigin(MetricOrigin.STALE);
            }
        } else if (cause instanceof NormalizationException) {
            logger.error("Upstream {} returned an unexpected payload: {}", upstreamId, cause.getMessage());
        }
        throw new CompletionException(cause);
    }
}
