package com.marketgateway.common.retry;

import com.marketgateway.common.exception.UpstreamCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential-backoff retry around a single upstream call.
 *
 * <p>Attempt {@code i} (0-indexed) that fails transiently is followed by a wait of
 * {@code baseDelay * 2^i}, unless the failure carries a {@code Retry-After} hint, which
 * replaces the computed delay for that attempt. Terminal failures and the failure of the
 * last attempt are propagated unchanged; translating them is the caller's concern.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final int MAX_SHIFT = 30;

    private final TransientFailureClassifier classifier;
    private final Scheduler scheduler;

    public RetryPolicy() {
        this(new TransientFailureClassifier(), Schedulers.parallel());
    }

    public RetryPolicy(TransientFailureClassifier classifier, Scheduler scheduler) {
        this.classifier = classifier;
        this.scheduler  = scheduler;
    }

    /**
     * @param call        produces a fresh upstream call per attempt
     * @param maxAttempts total attempts, first one included
     * @param baseDelay   delay after the first failed attempt
     */
    public <T> Mono<T> execute(Supplier<? extends Mono<T>> call, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return Mono.<T>defer(call)
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                Retry.RetrySignal state = signal.copy();
                Throwable lastError = state.failure();
                long attemptIndex = state.totalRetries();

                if (!classifier.isTransient(lastError)) {
                    log.debug("UPSTREAM_TERMINAL attempt={} reason={}", attemptIndex + 1, lastError.toString());
                    return Mono.error(lastError);
                }
                if (attemptIndex + 1 >= maxAttempts) {
                    log.warn("UPSTREAM_RETRIES_EXHAUSTED attempts={} reason={}", maxAttempts, lastError.toString());
                    return Mono.error(lastError);
                }
                Duration delay = delayFor(attemptIndex, lastError, baseDelay);
                log.warn("UPSTREAM_RETRY attempt={} maxAttempts={} delayMs={} reason={}",
                         attemptIndex + 1, maxAttempts, delay.toMillis(), lastError.toString());
                return Mono.delay(delay, scheduler);
            })));
    }

    /** Delay to wait after failed attempt {@code attemptIndex} before the next one. */
    public Duration delayFor(long attemptIndex, Throwable failure, Duration baseDelay) {
        if (failure instanceof UpstreamCallException upstream) {
            Duration hint = upstream.getRetryAfter().orElse(null);
            if (hint != null) {
                return hint;
            }
        }
        long factor = 1L << Math.min(attemptIndex, MAX_SHIFT);
        return baseDelay.multipliedBy(factor);
    }
}
