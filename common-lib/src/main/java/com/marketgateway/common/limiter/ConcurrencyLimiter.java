package com.marketgateway.common.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.function.Supplier;

/**
 * Bounds the number of concurrently executing reactive tasks.
 *
 * <p>At most {@code maxConcurrent} tasks run at once. Excess tasks wait in a FIFO queue
 * and are started as running tasks terminate. Each task reports its own result or error
 * to its own subscriber; a failing task only frees its slot.
 *
 * <p>Nothing blocks: admission and release are short critical sections on the limiter's
 * monitor, and the task itself runs outside of it.
 */
public class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final int maxConcurrent;
    private final Queue<Runnable> pending = new ArrayDeque<>();
    private int active;

    public ConcurrencyLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Runs the task once a slot is available. The task is subscribed lazily, on admission.
     */
    public <T> Mono<T> schedule(Supplier<? extends Mono<T>> task) {
        return Mono.create(sink -> {
            Runnable run = () -> Mono.<T>defer(task)
                .doFinally(signal -> release())
                .subscribe(
                    sink::success,
                    sink::error,
                    sink::success);
            if (admit(run)) {
                run.run();
            }
        });
    }

    public synchronized int activeCount() {
        return active;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    private synchronized boolean admit(Runnable run) {
        if (active < maxConcurrent) {
            active++;
            return true;
        }
        pending.add(run);
        log.debug("LIMITER_QUEUED active={} pending={}", active, pending.size());
        return false;
    }

    private void release() {
        Runnable next;
        synchronized (this) {
            next = pending.poll();
            if (next == null) {
                active--;
            }
        }
        // the freed slot passes straight to the next queued task
        if (next != null) {
            next.run();
        }
    }
}
