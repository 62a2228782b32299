package com.bristol.siteintel.testutil;

import com.bristol.siteintel.infrastructure.resilience.UpstreamCircuitBreaker;

import java.io.IOException;

public final class Breakers {

    private Breakers() {
    }

    /**
     * Records the given number of failed calls through granted permissions.
     */
    public static void recordFailures(UpstreamCircuitBreaker breaker, int failures) {
        for (int i = 0; i < failures; i++) {
            breaker.tryAcquirePermission()
                    .ifPresent(permit -> permit.onError(new IOException("connection reset")));
        }
    }
}
