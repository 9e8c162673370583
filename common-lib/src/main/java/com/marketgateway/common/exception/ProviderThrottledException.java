package com.marketgateway.common.exception;

/** The upstream provider kept answering 429 until retries ran out. */
public class ProviderThrottledException extends MarketDataException {

    public ProviderThrottledException(String message, Throwable cause) {
        super("PROVIDER_THROTTLED", 429, message, cause);
    }
}
