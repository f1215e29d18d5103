package com.propertyintel.listings.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient conversions from raw listing text. Nothing here throws: a value
 * that cannot be converted comes back as null.
 */
public final class ValueCoercion {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            SPACE_SEPARATED);

    private ValueCoercion() {
    }

    /**
     * Scrapers emit "" or "." for fields they could not read; both mean missing.
     */
    public static boolean isMissing(String val) {
        if (val == null) return true;
        String trimmed = val.trim();
        return trimmed.isEmpty() || ".".equals(trimmed);
    }

    /**
     * Parse a plain decimal number, keeping its fractional part.
     * NaN, infinities, hex and type-suffixed literals are rejected.
     */
    public static Double toDouble(String val) {
        BigDecimal exact = toDecimal(val);
        if (exact == null) return null;
        double parsed = exact.doubleValue();
        return Double.isFinite(parsed) ? parsed : null;
    }

    /**
     * The decimal value exactly as written, for comparisons that must not
     * pick up binary rounding.
     */
    public static BigDecimal toDecimal(String val) {
        if (isMissing(val)) return null;
        try {
            return new BigDecimal(val.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Calendar year of a timestamp as written (an offset, if any, is not applied).
     */
    public static Integer yearOf(String timestamp) {
        if (isMissing(timestamp)) return null;
        String val = timestamp.trim();

        Integer year = parseYear(val, v -> OffsetDateTime.parse(v).getYear());
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            if (year != null) break;
            year = parseYear(val, v -> LocalDateTime.parse(v, format).getYear());
        }
        if (year == null) {
            year = parseYear(val, v -> LocalDate.parse(v).getYear());
        }
        return year;
    }

    private static Integer parseYear(String val, Function<String, Integer> parser) {
        try {
            return parser.apply(val);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
