package com.marketgateway.marketdata.cache;

import com.marketgateway.marketdata.service.UsMarketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops cache entries that are past their stale deadline.
 *
 * <p>Reads already ignore such entries; the sweep only bounds memory for symbols that
 * stop being requested.
 */
@Component
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final UsMarketService usMarketService;

    public CacheSweeper(UsMarketService usMarketService) {
        this.usMarketService = usMarketService;
    }

    @Scheduled(fixedDelayString = "${market-data.cache.sweep-interval-ms:60000}",
               initialDelayString = "${market-data.cache.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = usMarketService.evictExpired();
        if (removed > 0) {
            log.info("CACHE_SWEEP removed={} remaining={}", removed, usMarketService.cachedEntryCount());
        }
    }
}
