package com.bristol.siteintel.infrastructure.cron;

import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.infrastructure.cache.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledCacheSweeper {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCacheSweeper.class);
    private final ResponseCache<MetricResult> cache;

    public ScheduledCacheSweeper(ResponseCache<MetricResult> cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${siteintel.cache.sweep-interval:PT5M}")
    public void sweep() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            logger.info("Swept {} cache entries past stale retention, {} still stored", removed, cache.getStats().storedEntries());
        } else {
            logger.debug("Cache sweep found nothing to evict");
        }
    }
}
