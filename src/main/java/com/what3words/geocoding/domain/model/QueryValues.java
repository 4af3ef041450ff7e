package com.what3words.geocoding.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formatting helpers for query-parameter values.
 */
final class QueryValues {

    private QueryValues() {
        // Utility class
    }

    /**
     * Shortest plain decimal rendering of a double: no exponent, no trailing
     * zeros ({@code 1000.0} is written {@code 1000}). NaN and infinities are
     * passed through as {@code NaN} / {@code Infinity}.
     */
    static String number(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String coordinates(List<Coordinates> points) {
        return points.stream()
            .map(Coordinates::toQueryValue)
            .collect(Collectors.joining(","));
    }
}
