package com.marketgateway.common.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Throttles upstream traffic to stay under a provider's own rate limits.
 *
 * <p>Two rules apply to every scheduled request:
 * <ol>
 *   <li>at most {@code maxConcurrent} requests are in flight (delegated to a
 *       {@link ConcurrencyLimiter});</li>
 *   <li>consecutive request starts are at least {@code minDelay} apart.</li>
 * </ol>
 *
 * <p>The spacing wait is a {@code Mono.delay} on the given scheduler and holds the
 * concurrency slot it was admitted with.
 */
public class RequestPacer {

    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    private static final long NEVER = Long.MIN_VALUE;

    private final ConcurrencyLimiter limiter;
    private final long minDelayMs;
    private final Scheduler scheduler;
    private long lastStartMs = NEVER;

    public RequestPacer(Duration minDelay, int maxConcurrent) {
        this(minDelay, maxConcurrent, Schedulers.parallel());
    }

    public RequestPacer(Duration minDelay, int maxConcurrent, Scheduler scheduler) {
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must be non-negative");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.limiter = new ConcurrencyLimiter(maxConcurrent);
        this.minDelayMs = minDelay.toMillis();
        this.scheduler = scheduler;
    }

    public <T> Mono<T> schedule(Supplier<? extends Mono<T>> task) {
        return limiter.schedule(() -> Mono.defer(() -> {
            long waitMs = reserveStartSlot();
            Mono<T> call = Mono.defer(task);
            if (waitMs <= 0) {
                return call;
            }
            log.debug("PACER_WAIT waitMs={}", waitMs);
            return Mono.delay(Duration.ofMillis(waitMs), scheduler).then(call);
        }));
    }

    public int activeCount() {
        return limiter.activeCount();
    }

    public int pendingCount() {
        return limiter.pendingCount();
    }

    /** Claims the next start time and returns how long the caller has to wait for it. */
    private synchronized long reserveStartSlot() {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        long start = lastStartMs == NEVER ? now : Math.max(now, lastStartMs + minDelayMs);
        lastStartMs = start;
        return start - now;
    }
}
