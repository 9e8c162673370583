package com.marketgateway.common.coalesce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Collapses concurrent identical requests into one underlying call.
 *
 * <p>The first caller for a key registers a one-shot result sink and subscribes to the
 * factory's {@link Mono}; every caller arriving while it is in flight subscribes to that same
 * sink and receives the same terminal signal. The registry entry is removed exactly once,
 * when the underlying call terminates, whatever the outcome.
 *
 * <p>Keys are independent: there is no lock spanning keys, only the per-bin atomicity of
 * {@link ConcurrentHashMap#computeIfAbsent}. The underlying subscription is owned by the
 * coalescer, not by any caller, so it runs to completion even if every caller cancels.
 */
public class RequestCoalescer {

    private static final Logger log = LoggerFactory.getLogger(RequestCoalescer.class);

    private final ConcurrentHashMap<String, Mono<?>> inFlight = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> Mono<T> run(String key, Supplier<? extends Mono<T>> factory) {
        return Mono.defer(() -> {
            AtomicReference<Sinks.One<T>> created = new AtomicReference<>();
            Mono<?> shared = inFlight.computeIfAbsent(key, k -> {
                Sinks.One<T> sink = Sinks.one();
                created.set(sink);
                return sink.asMono();
            });

            Sinks.One<T> owner = created.get();
            if (owner == null) {
                log.debug("COALESCED_JOIN key={}", key);
            } else {
                start(key, (Mono<T>) shared, owner, factory);
            }
            return (Mono<T>) shared;
        });
    }

    /** Number of keys with a call currently in flight. */
    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    private <T> void start(String key, Mono<T> registered, Sinks.One<T> sink,
                           Supplier<? extends Mono<T>> factory) {
        Mono.<T>defer(factory)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .doFinally(signal -> {
                inFlight.remove(key, registered);
                log.debug("COALESCED_SETTLED key={} signal={}", key, signal);
            })
            .subscribe(
                result -> emitAccepted(key, result.isPresent() ? sink.tryEmitValue(result.get()) : sink.tryEmitEmpty()),
                error -> emitAccepted(key, sink.tryEmitError(error)));
    }

    /** A rejected emission leaves joiners without a result, so it is logged rather than dropped. */
    static boolean emitAccepted(String key, Sinks.EmitResult result) {
        if (result.isSuccess()) {
            return true;
        }
        log.error("COALESCED_EMIT_FAILED key={} result={}", key, result);
        return false;
    }
}
