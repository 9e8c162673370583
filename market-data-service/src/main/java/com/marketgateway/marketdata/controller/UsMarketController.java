package com.marketgateway.marketdata.controller;

import com.marketgateway.common.exception.ValidationException;
import com.marketgateway.marketdata.model.ApiResponse;
import com.marketgateway.marketdata.model.NormalizedChart;
import com.marketgateway.marketdata.model.NormalizedQuote;
import com.marketgateway.marketdata.params.RangeDays;
import com.marketgateway.marketdata.service.UsMarketService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Thin HTTP surface over {@link UsMarketService}. Errors are rendered by
 * {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/us")
public class UsMarketController {

    /** Used when {@code /quotes} is called without symbols. */
    public static final List<String> DEFAULT_SYMBOLS = List.of("AAPL", "MSFT", "GOOGL", "AMZN", "NVDA");

    private final UsMarketService service;

    public UsMarketController(UsMarketService service) {
        this.service = service;
    }

    @GetMapping("/quote")
    public Mono<ApiResponse<NormalizedQuote>> getQuote(@RequestParam(required = false) String symbol) {
        return Mono.defer(() -> service.getQuote(requireParam("symbol", symbol)))
            .map(ApiResponse::success);
    }

    @GetMapping("/quotes")
    public Mono<ApiResponse<List<NormalizedQuote>>> getQuotes(@RequestParam(required = false) String symbols) {
        List<String> symbolList = symbols == null ? List.of() : Arrays.stream(symbols.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (symbolList.isEmpty()) {
            symbolList = DEFAULT_SYMBOLS;
        }
        return service.getQuotes(symbolList).map(ApiResponse::success);
    }

    @GetMapping("/chart")
    public Mono<ApiResponse<NormalizedChart>> getChart(@RequestParam(required = false) String symbol,
                                                        @RequestParam(required = false) String interval,
                                                        @RequestParam(required = false) String rangeDays) {
        return Mono.defer(() -> service.getChart(requireParam("symbol", symbol), interval, RangeDays.parse(rangeDays)))
            .map(ApiResponse::success);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static String requireParam(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required query parameter: " + name);
        }
        return value.trim();
    }
}
