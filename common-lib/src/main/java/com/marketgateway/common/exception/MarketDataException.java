package com.marketgateway.common.exception;

/**
 * Base of the error taxonomy surfaced to callers of the fetch layer.
 *
 * <p>Transport-specific failures never escape the provider boundary as-is; they are
 * translated into one of the subclasses so that the API layer can map each to a
 * stable error code and HTTP status.
 */
public abstract class MarketDataException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    protected MarketDataException(String code, int httpStatus, String message) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    protected MarketDataException(String code, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
