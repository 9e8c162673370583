package com.marketgateway.common.exception;

/** Any other failure left over once retries and the stale fallback are exhausted. */
public class UnavailableException extends MarketDataException {

    public UnavailableException(String message, Throwable cause) {
        super("UNAVAILABLE", 503, message, cause);
    }
}
