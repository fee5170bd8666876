package io.marketlens.analytics.parse;

import io.marketlens.analytics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Regex-guarded casts for raw payload text. A malformed value never throws: it falls back to the
 * documented default and is logged at debug level.
 */
public final class FieldCasts {
    private static final Logger LOG = LoggerFactory.getLogger(FieldCasts.class);

    public static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");
    public static final long MAX_COUNT = Long.MAX_VALUE;
    public static final String DEFAULT_CURRENCY = "USD";

    private static final BigDecimal MICROS_PER_UNIT = BigDecimal.valueOf(1_000_000L);
    private static final Pattern DECIMAL = Pattern.compile("^-?[0-9]+\\.?[0-9]*([eE][+-]?[0-9]+)?$");
    private static final Pattern INTEGER = Pattern.compile("^-?[0-9]+$");
    private static final Pattern DATE_PREFIX = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}");
    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    private FieldCasts() {}

    /**
     * Non-negative decimal clamped to {@link #MAX_AMOUNT}; blank or malformed input is zero.
     */
    public static BigDecimal decimal(String raw) {
        BigDecimal parsed = parseDecimal(raw);
        return parsed == null ? BigDecimal.ZERO : clamp(parsed);
    }

    /**
     * Decimal or null when absent; used for optional platform-reported ratios.
     */
    public static BigDecimal nullableDecimal(String raw) {
        BigDecimal parsed = parseDecimal(raw);
        return parsed == null ? null : clamp(parsed);
    }

    /**
     * Micro-currency amount (1/1,000,000 of a unit) converted to units, then clamped.
     */
    public static BigDecimal micros(String raw) {
        BigDecimal parsed = parseDecimal(raw);
        if (parsed == null) {
            return BigDecimal.ZERO;
        }
        return clamp(parsed.divide(MICROS_PER_UNIT, 6, RoundingMode.HALF_UP));
    }

    /**
     * Non-negative integer clamped to {@link #MAX_COUNT}; blank or malformed input is zero.
     */
    public static long integer(String raw) {
        Long parsed = nullableInteger(raw);
        return parsed == null ? 0L : parsed;
    }

    public static Long nullableInteger(String raw) {
        String value = StringSemantics.trimToNull(raw);
        if (value == null) {
            return null;
        }
        if (!INTEGER.matcher(value).matches()) {
            LOG.debug("Malformed integer value '{}' defaulted", value);
            return null;
        }
        try {
            return Math.max(0L, Long.parseLong(value));
        } catch (NumberFormatException ex) {
            LOG.debug("Integer value '{}' out of range, clamped", value);
            return value.startsWith("-") ? 0L : MAX_COUNT;
        }
    }

    /**
     * Calendar date from a value starting with {@code YYYY-MM-DD}; anything else is null.
     */
    public static LocalDate date(String raw) {
        String value = StringSemantics.trimToNull(raw);
        if (value == null || !DATE_PREFIX.matcher(value).find()) {
            if (value != null) {
                LOG.debug("Value '{}' has no date prefix", value);
            }
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException ex) {
            LOG.debug("Invalid calendar date '{}'", value);
            return null;
        }
    }

    /**
     * ISO-8601 instant. Offset-less timestamps are read as UTC; a bare date is its UTC midnight.
     */
    public static Instant timestamp(String raw) {
        String value = StringSemantics.trimToNull(raw);
        if (value == null) {
            return null;
        }
        Instant parsed = parseOffsetDateTime(value);
        if (parsed == null) {
            parsed = parseLocalDateTime(value);
        }
        if (parsed != null) {
            return parsed;
        }
        LocalDate date = date(value);
        if (date == null) {
            return null;
        }
        if (value.length() > 10) {
            LOG.debug("Unparseable timestamp '{}' truncated to its date", value);
        }
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Three-letter upper-case currency code, {@link #DEFAULT_CURRENCY} otherwise.
     */
    public static String currency(String raw) {
        String value = StringSemantics.trimToNull(raw);
        if (value == null) {
            return DEFAULT_CURRENCY;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(upper).matches()) {
            LOG.debug("Invalid currency '{}' defaulted to {}", value, DEFAULT_CURRENCY);
            return DEFAULT_CURRENCY;
        }
        return upper;
    }

    private static Instant parseOffsetDateTime(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static Instant parseLocalDateTime(String value) {
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static BigDecimal parseDecimal(String raw) {
        String value = StringSemantics.trimToNull(raw);
        if (value == null) {
            return null;
        }
        if (!DECIMAL.matcher(value).matches()) {
            LOG.debug("Malformed decimal value '{}' defaulted", value);
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException ex) {
            LOG.debug("Decimal value '{}' not representable, defaulted", value);
            return null;
        }
    }

    private static BigDecimal clamp(BigDecimal value) {
        if (value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value.compareTo(MAX_AMOUNT) > 0 ? MAX_AMOUNT : value;
    }
}
