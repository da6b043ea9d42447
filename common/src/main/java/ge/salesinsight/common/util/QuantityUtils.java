package ge.salesinsight.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing quantities and amounts from spreadsheet cells.
 */
public final class QuantityUtils {

    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    private QuantityUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse a numeric cell value.
     *
     * Handles:
     * - Numbers (returned as-is)
     * - Blank values (treated as zero)
     * - Strings with thousands separators or whitespace
     * - Comma as decimal separator when no dot is present
     *
     * @param value Value to parse
     * @return BigDecimal value, or null if the value is not numeric
     */
    public static BigDecimal parseDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }

        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }

        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }

        String stringValue = value.toString()
                .replaceAll("[\\s\\u00A0\\u202F\\u2009]+", "")
                .trim();

        if (stringValue.isEmpty()) {
            return BigDecimal.ZERO;
        }

        if (stringValue.contains(",") && !stringValue.contains(".")) {
            stringValue = stringValue.replace(",", ".");
        } else {
            stringValue = stringValue.replaceAll("[,\\u066C]", "");
        }

        Matcher matcher = NUMERIC_PATTERN.matcher(stringValue);
        if (!matcher.matches()) {
            return null;
        }
        return new BigDecimal(stringValue);
    }

    /**
     * Round to the given number of decimal places.
     */
    public static BigDecimal round(BigDecimal value, int scale) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        return value.setScale(scale, RoundingMode.HALF_UP);
    }

    /**
     * Check if value is negative.
     */
    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}
