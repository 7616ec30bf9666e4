package kr.lsfeed.domain.stream;

import java.math.BigDecimal;

/**
 * Lenient parsing of numeric wire fields, which the feed sends as strings.
 */
public final class WireNumbers {

    /**
     * Parse a BigDecimal (handles null, blank and garbage as null).
     */
    public static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse a long, defaulting to 0 for blank or malformed values.
     */
    public static long longValue(String value) {
        BigDecimal d = decimal(value);
        return d == null ? 0L : d.longValue();
    }

    private WireNumbers() {}
}
