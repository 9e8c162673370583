package com.marketgateway.marketdata.controller;

import com.marketgateway.common.exception.MarketDataException;
import com.marketgateway.marketdata.model.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the fetch-layer taxonomy onto {@code {ok:false, error:{code, message}}} responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MarketDataException.class)
    public ResponseEntity<ApiResponse<Void>> handleMarketData(MarketDataException e) {
        if (e.getHttpStatus() >= 500) {
            log.warn("Request failed. code={} message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getHttpStatus())
            .body(ApiResponse.failure(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.failure("INTERNAL_ERROR", "Internal Server Error"));
    }
}
