package com.marketgateway.common.coalesce;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RequestCoalescerTest {

    private RequestCoalescer coalescer;

    @BeforeEach
    void setUp() {
        coalescer = new RequestCoalescer();
    }

    @Test
    @DisplayName("N concurrent callers for one key share a single upstream call and the same result")
    void concurrentCallersShareOneCall() {
        AtomicInteger calls = new AtomicInteger();
        Sinks.One<Object> upstream = Sinks.one();
        Supplier<Mono<Object>> factory = () -> {
            calls.incrementAndGet();
            return upstream.asMono();
        };

        List<Object> results = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 5; i++) {
            coalescer.run("us:quote:AAPL", factory).subscribe(results::add);
        }

        assertEquals(1, calls.get());
        assertTrue(coalescer.isInFlight("us:quote:AAPL"));
        assertTrue(results.isEmpty());

        Object payload = new Object();
        upstream.tryEmitValue(payload);

        assertEquals(5, results.size());
        results.forEach(r -> assertSame(payload, r));
        assertEquals(0, coalescer.inFlightCount());
    }

    @Test
    @DisplayName("a failure is delivered to every waiting caller and clears the registry")
    void failureIsShared() {
        AtomicInteger calls = new AtomicInteger();
        Sinks.One<String> upstream = Sinks.one();
        Supplier<Mono<String>> factory = () -> {
            calls.incrementAndGet();
            return upstream.asMono();
        };

        List<Throwable> errors = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 3; i++) {
            coalescer.run("k", factory).subscribe(v -> fail("unexpected value"), errors::add);
        }
        IllegalStateException boom = new IllegalStateException("boom");
        upstream.tryEmitError(boom);

        assertEquals(1, calls.get());
        assertEquals(3, errors.size());
        errors.forEach(e -> assertSame(boom, e));
        assertFalse(coalescer.isInFlight("k"));
    }

    @Test
    @DisplayName("once settled, the next call for the key invokes the factory again")
    void settledKeyIsReinvoked() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<Integer>> factory = () -> Mono.just(calls.incrementAndGet());

        StepVerifier.create(coalescer.run("k", factory)).expectNext(1).verifyComplete();
        StepVerifier.create(coalescer.run("k", factory)).expectNext(2).verifyComplete();
        assertEquals(0, coalescer.inFlightCount());
    }

    @Test
    @DisplayName("different keys run independently")
    void differentKeysAreIndependent() {
        Sinks.One<String> first = Sinks.one();
        Sinks.One<String> second = Sinks.one();
        List<String> results = new CopyOnWriteArrayList<>();

        coalescer.run("a", first::asMono).subscribe(results::add);
        coalescer.run("b", second::asMono).subscribe(results::add);
        assertEquals(2, coalescer.inFlightCount());

        second.tryEmitValue("B");
        assertEquals(List.of("B"), results);
        assertTrue(coalescer.isInFlight("a"));

        first.tryEmitValue("A");
        assertEquals(List.of("B", "A"), results);
        assertEquals(0, coalescer.inFlightCount());
    }

    @Test
    @DisplayName("an empty completion also releases the key")
    void emptyCompletionReleases() {
        StepVerifier.create(coalescer.run("k", Mono::<String>empty)).verifyComplete();
        assertFalse(coalescer.isInFlight("k"));
    }

    @Test
    @DisplayName("the shared call keeps running after its callers cancel")
    void callerCancellationDoesNotCancelSharedCall() {
        Sinks.One<String> upstream = Sinks.one();
        coalescer.run("k", upstream::asMono).subscribe().dispose();

        List<String> late = new CopyOnWriteArrayList<>();
        coalescer.run("k", () -> Mono.just("second-call")).subscribe(late::add);
        upstream.tryEmitValue("first-call");

        assertEquals(List.of("first-call"), late);
        assertFalse(coalescer.isInFlight("k"));
    }

    // ── emission bookkeeping ────────────────────────────────────────────────

    @Test
    @DisplayName("settling with a value, an error or empty raises no emission failure")
    void everyOutcomeIsEmittedOnce() {
        ListAppender<ILoggingEvent> appender = attachAppender();
        try {
            StepVerifier.create(coalescer.run("value", () -> Mono.just("v"))).expectNext("v").verifyComplete();
            StepVerifier.create(coalescer.run("error", () -> Mono.<String>error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();
            StepVerifier.create(coalescer.run("empty", Mono::<String>empty)).verifyComplete();

            assertTrue(appender.list.stream().noneMatch(e -> e.getLevel() == Level.ERROR));
        } finally {
            detachAppender(appender);
        }
    }

    @Test
    @DisplayName("a rejected emission is reported instead of silently dropped")
    void rejectedEmissionIsLogged() {
        ListAppender<ILoggingEvent> appender = attachAppender();
        try {
            Sinks.One<String> sink = Sinks.one();
            assertTrue(RequestCoalescer.emitAccepted("k", sink.tryEmitValue("first")));
            assertFalse(RequestCoalescer.emitAccepted("k", sink.tryEmitValue("second")));

            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getFormattedMessage().startsWith("COALESCED_EMIT_FAILED key=k")));
        } finally {
            detachAppender(appender);
        }
    }

    private static ListAppender<ILoggingEvent> attachAppender() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(RequestCoalescer.class)).addAppender(appender);
        return appender;
    }

    private static void detachAppender(ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(RequestCoalescer.class)).detachAppender(appender);
    }
}
