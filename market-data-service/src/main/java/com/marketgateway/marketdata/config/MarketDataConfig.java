package com.marketgateway.marketdata.config;

import com.marketgateway.common.limiter.RequestPacer;
import com.marketgateway.common.retry.RetryPolicy;
import com.marketgateway.marketdata.client.NettyTransportFailureClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableScheduling
public class MarketDataConfig {

    @Value("${market-data.quote-ttl-ms:5000}")
    private long quoteTtlMs;

    @Value("${market-data.chart-ttl-ms:60000}")
    private long chartTtlMs;

    @Value("${market-data.max-stale-ms:120000}")
    private long maxStaleMs;

    @Value("${market-data.max-batch-symbols:25}")
    private int maxBatchSymbols;

    @Value("${market-data.batch-concurrency:3}")
    private int batchConcurrency;

    @Value("${market-data.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${market-data.retry.base-delay-ms:1000}")
    private long baseDelayMs;

    @Value("${finnhub.min-delay-ms:120}")
    private long pacerMinDelayMs;

    @Value("${finnhub.max-concurrent:3}")
    private int pacerMaxConcurrent;

    @Bean
    public MarketDataSettings marketDataSettings() {
        return new MarketDataSettings(
            Duration.ofMillis(quoteTtlMs),
            Duration.ofMillis(chartTtlMs),
            Duration.ofMillis(maxStaleMs),
            maxBatchSymbols,
            batchConcurrency,
            maxAttempts,
            Duration.ofMillis(baseDelayMs));
    }

    /** Shared by every upstream Finnhub call, so the provider sees one paced client. */
    @Bean
    public RequestPacer finnhubRequestPacer() {
        return new RequestPacer(Duration.ofMillis(pacerMinDelayMs), pacerMaxConcurrent);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(new NettyTransportFailureClassifier(), Schedulers.parallel());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
