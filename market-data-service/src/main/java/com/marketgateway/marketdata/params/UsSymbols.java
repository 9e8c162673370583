package com.marketgateway.marketdata.params;

import com.marketgateway.common.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Plain US tickers such as {@code AAPL}, {@code BRK.B} or {@code BF-B}; no market suffixes.
 */
public final class UsSymbols {

    /** First char A-Z, then up to nine of A-Z, 0-9, dot or dash. */
    public static final Pattern US_SYMBOL = Pattern.compile("^[A-Z][A-Z0-9.-]{0,9}$");

    private UsSymbols() {}

    /**
     * Trims and upper-cases {@code input}.
     *
     * @throws ValidationException when the result is not a valid ticker
     */
    public static String normalize(String input) {
        if (input == null) {
            throw new ValidationException("Invalid US symbol format");
        }
        String normalized = input.trim().toUpperCase(Locale.ROOT);
        if (!US_SYMBOL.matcher(normalized).matches()) {
            throw new ValidationException("Invalid US symbol format");
        }
        return normalized;
    }
}
