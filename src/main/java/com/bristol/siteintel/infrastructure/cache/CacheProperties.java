package com.bristol.siteintel.infrastructure.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "siteintel.cache")
public class CacheProperties {

    /**
     * How long past expiry an entry can still be served as a stale fallback
     */
    private Duration staleRetention = Duration.ofHours(24);

    private long maximumSize = 10_000;

    private Duration sweepInterval = Duration.ofMinutes(5);

    public Duration getStaleRetention() {
        return staleRetention;
    }

    public void setStaleRetention(Duration staleRetention) {
        this.staleRetention = staleRetention;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
