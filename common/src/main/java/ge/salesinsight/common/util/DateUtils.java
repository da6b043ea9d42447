package ge.salesinsight.common.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for date parsing and calendar bucketing.
 * Handles multiple date formats including Excel serial numbers.
 */
public final class DateUtils {

    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final Pattern MDY_PATTERN = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern YMD_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    // YYYY-MM-DDTHH:mm:ss or YYYY-MM-DD HH:mm:ss, optional fraction
    private static final Pattern ISO_DATETIME_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})[T ].*$");

    // Day 0 of the Excel 1900 date system, shifted for the 1900 leap year bug
    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private DateUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse date from various formats to LocalDate.
     *
     * Supports:
     * - LocalDate / LocalDateTime / java.util.Date values (native spreadsheet cells)
     * - Excel serial numbers
     * - MM/DD/YYYY strings
     * - YYYY-MM-DD strings
     * - ISO datetime strings
     *
     * @param dateValue Date value in any supported format
     * @return LocalDate or null if parsing fails
     */
    public static LocalDate parseDate(Object dateValue) {
        if (dateValue == null) {
            return null;
        }

        if (dateValue instanceof LocalDate) {
            return (LocalDate) dateValue;
        }
        if (dateValue instanceof LocalDateTime) {
            return ((LocalDateTime) dateValue).toLocalDate();
        }
        if (dateValue instanceof Date) {
            return ((Date) dateValue).toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }

        if (dateValue instanceof Number) {
            return parseExcelSerialDate(((Number) dateValue).doubleValue());
        }

        String dateStr = dateValue.toString().trim();
        if (dateStr.isEmpty()) {
            return null;
        }

        // Try Excel serial as string
        try {
            double serial = Double.parseDouble(dateStr);
            return parseExcelSerialDate(serial);
        } catch (NumberFormatException ignored) {
            // Not a number, try string formats
        }

        try {
            Matcher mdyMatcher = MDY_PATTERN.matcher(dateStr);
            if (mdyMatcher.matches()) {
                int month = Integer.parseInt(mdyMatcher.group(1));
                int day = Integer.parseInt(mdyMatcher.group(2));
                int year = Integer.parseInt(mdyMatcher.group(3));
                return LocalDate.of(year, month, day);
            }

            Matcher ymdMatcher = YMD_PATTERN.matcher(dateStr);
            if (ymdMatcher.matches()) {
                int year = Integer.parseInt(ymdMatcher.group(1));
                int month = Integer.parseInt(ymdMatcher.group(2));
                int day = Integer.parseInt(ymdMatcher.group(3));
                return LocalDate.of(year, month, day);
            }

            Matcher isoDatetimeMatcher = ISO_DATETIME_PATTERN.matcher(dateStr);
            if (isoDatetimeMatcher.matches()) {
                int year = Integer.parseInt(isoDatetimeMatcher.group(1));
                int month = Integer.parseInt(isoDatetimeMatcher.group(2));
                int day = Integer.parseInt(isoDatetimeMatcher.group(3));
                return LocalDate.of(year, month, day);
            }
        } catch (java.time.DateTimeException e) {
            // Pattern matched but the fields are out of range, e.g. 2024-02-31
            return null;
        }

        try {
            return LocalDate.parse(dateStr, ISO_FORMAT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    /**
     * Parse Excel serial date number to LocalDate.
     * Valid Excel serial dates are between 1 (January 1, 1900) and 60000 (year 2064).
     */
    public static LocalDate parseExcelSerialDate(double serialDate) {
        if (serialDate < 1 || serialDate > 60000) {
            return null;
        }
        return EXCEL_EPOCH.plusDays((long) Math.floor(serialDate));
    }

    /**
     * Format LocalDate to YYYY-MM-DD string.
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : date.format(ISO_FORMAT);
    }

    /**
     * Last day of the month, the label used for monthly buckets.
     */
    public static LocalDate monthEnd(YearMonth month) {
        return month.atEndOfMonth();
    }

    /**
     * Calendar quarter label in the form {@code 2024Q1}. Labels sort lexicographically
     * in chronological order.
     */
    public static String quarterLabel(LocalDate date) {
        int quarter = (date.getMonthValue() - 1) / 3 + 1;
        return String.format("%04dQ%d", date.getYear(), quarter);
    }
}
