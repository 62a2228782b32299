package com.bristol.siteintel.infrastructure.resilience;

import java.util.concurrent.CompletableFuture;

/**
 * A single attempt against an upstream. Cancelling the returned future must abort the attempt.
 */
@FunctionalInterface
public interface UpstreamCall<T> {

    CompletableFuture<T> attempt();
}
