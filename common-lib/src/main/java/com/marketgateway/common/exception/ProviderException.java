package com.marketgateway.common.exception;

/**
 * The upstream provider answered with an error status after retries, or reported
 * that it has no data for the request.
 */
public class ProviderException extends MarketDataException {

    public ProviderException(String message) {
        super("PROVIDER_ERROR", 502, message);
    }

    public ProviderException(String message, Throwable cause) {
        super("PROVIDER_ERROR", 502, message, cause);
    }
}
