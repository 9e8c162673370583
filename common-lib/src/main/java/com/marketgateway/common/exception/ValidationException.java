package com.marketgateway.common.exception;

/** Bad caller input, rejected before any upstream I/O. */
public class ValidationException extends MarketDataException {

    public ValidationException(String message) {
        super("BAD_REQUEST", 400, message);
    }
}
