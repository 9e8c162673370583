package com.marketgateway.marketdata.client;

import java.util.Arrays;
import java.util.Optional;

/**
 * Candle resolutions accepted by {@code /stock/candle}: minutes, then day/week/month.
 */
public enum FinnhubResolution {
    ONE_MINUTE("1"),
    FIVE_MINUTES("5"),
    FIFTEEN_MINUTES("15"),
    THIRTY_MINUTES("30"),
    ONE_HOUR("60"),
    DAY("D"),
    WEEK("W"),
    MONTH("M");

    private final String code;

    FinnhubResolution(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<FinnhubResolution> fromCode(String code) {
        return Arrays.stream(values()).filter(r -> r.code.equals(code)).findFirst();
    }
}
