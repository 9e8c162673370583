package com.marketgateway.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Normalized transport-level failure of a single upstream call.
 *
 * <p>Produced by provider clients and consumed by the retry layer, which needs the HTTP
 * status and any {@code Retry-After} hint to classify and pace the next attempt. It never
 * reaches callers of the fetch layer: once retries are exhausted it is translated by
 * {@link UpstreamErrorTranslator}.
 */
public class UpstreamCallException extends RuntimeException {

    public enum Kind {
        /** Upstream answered with a non-2xx status. */
        HTTP,
        /** Connection refused/reset, timeout, DNS failure and the like. */
        NETWORK,
        /** Upstream answered but the body could not be read. */
        MALFORMED
    }

    private final Kind kind;
    private final Integer status;
    private final Duration retryAfter;

    private UpstreamCallException(Kind kind, Integer status, Duration retryAfter,
                                  String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public static UpstreamCallException http(int status, Duration retryAfter, Throwable cause) {
        return new UpstreamCallException(Kind.HTTP, status, retryAfter,
            "Upstream responded with HTTP " + status, cause);
    }

    public static UpstreamCallException network(Throwable cause) {
        return new UpstreamCallException(Kind.NETWORK, null, null,
            "Upstream network failure: " + cause.getClass().getSimpleName(), cause);
    }

    public static UpstreamCallException malformed(String detail, Throwable cause) {
        return new UpstreamCallException(Kind.MALFORMED, null, null,
            "Malformed upstream response: " + detail, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status, or {@code null} when the failure happened below HTTP. */
    public Integer getStatus() {
        return status;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
