package com.marketgateway.marketdata.params;

import com.marketgateway.common.exception.ValidationException;
import com.marketgateway.marketdata.client.FinnhubResolution;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Chart intervals offered to API clients and the provider resolution each maps to.
 */
public enum UsInterval {
    M1("1m", FinnhubResolution.ONE_MINUTE),
    M5("5m", FinnhubResolution.FIVE_MINUTES),
    M15("15m", FinnhubResolution.FIFTEEN_MINUTES),
    M30("30m", FinnhubResolution.THIRTY_MINUTES),
    H1("1h", FinnhubResolution.ONE_HOUR),
    D1("1d", FinnhubResolution.DAY);

    public static final UsInterval DEFAULT = H1;

    private final String label;
    private final FinnhubResolution resolution;

    UsInterval(String label, FinnhubResolution resolution) {
        this.label = label;
        this.resolution = resolution;
    }

    public String label() {
        return label;
    }

    public FinnhubResolution resolution() {
        return resolution;
    }

    /**
     * Blank input resolves to {@link #DEFAULT}; anything outside the enumerated set is rejected.
     */
    public static UsInterval parse(String input) {
        if (input == null || input.isBlank()) {
            return DEFAULT;
        }
        String key = input.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(i -> i.label.equals(key))
            .findFirst()
            .orElseThrow(() -> new ValidationException("interval must be one of "
                + Arrays.stream(values()).map(UsInterval::label).collect(Collectors.joining(", "))));
    }
}
