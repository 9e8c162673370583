package com.marketgateway.marketdata.params;

import com.marketgateway.common.exception.ValidationException;

public final class RangeDays {

    public static final int DEFAULT = 5;
    public static final int MIN = 1;
    public static final int MAX = 365;

    private RangeDays() {}

    /** Blank → {@link #DEFAULT}; otherwise an integer in [MIN, MAX]. */
    public static int parse(String input) {
        if (input == null || input.isBlank()) {
            return DEFAULT;
        }
        try {
            return validate(Integer.parseInt(input.trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException("rangeDays must be an integer between " + MIN + " and " + MAX);
        }
    }

    public static int validate(int rangeDays) {
        if (rangeDays < MIN || rangeDays > MAX) {
            throw new ValidationException("rangeDays must be between " + MIN + " and " + MAX);
        }
        return rangeDays;
    }
}
