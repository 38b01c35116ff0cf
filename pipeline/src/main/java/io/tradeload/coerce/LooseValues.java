package io.tradeload.coerce;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Conversions from the loosely-typed values found in raw batches (strings, boxed numbers, null).
 * Shared by validation, which only asks whether a value converts, and coercion, which keeps the result.
 */
public final class LooseValues {
    private LooseValues() {}

    public static boolean isMissing(Object v) {
        return v == null || (v instanceof String s && s.isBlank());
    }

    public static BigDecimal toDecimal(Object v) {
        if (v instanceof BigDecimal d) return d;
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) return BigDecimal.valueOf(((Number) v).longValue());
        if (v instanceof BigInteger bi) return new BigDecimal(bi);
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) throw new NumberFormatException("not a finite number: " + v);
            // valueOf keeps the shortest decimal representation, so 100.01 stays 100.01
            return BigDecimal.valueOf(d);
        }
        if (v instanceof String s) return new BigDecimal(s.trim());
        throw new NumberFormatException("not a number: " + (v == null ? "null" : v.getClass().getSimpleName()));
    }

    /**
     * Describes why {@code d} cannot be stored in a DECIMAL(precision, scale) column, or returns null when it fits.
     * Reads only precision and scale, never the expanded value.
     * Fractional digits beyond {@code scale} are accepted up to {@code precision} and rounded on coercion.
     */
    public static String decimalBoundsProblem(BigDecimal d, int precision, int scale) {
        long integerDigits = (long) d.precision() - d.scale();
        if (d.signum() != 0 && integerDigits > precision - scale) {
            return "exceeds DECIMAL(" + precision + "," + scale + ")";
        }
        if (d.scale() > precision && d.stripTrailingZeros().scale() > precision) {
            return "has more than " + precision + " fractional digits for DECIMAL(" + precision + "," + scale + ")";
        }
        return null;
    }

    /** Integral value of {@code v}; fails when the value has a non-zero fractional part or overflows a long. */
    public static long toLong(Object v) {
        if (v instanceof Long l) return l;
        if (v instanceof Integer i) return i;
        try {
            return toDecimal(v).longValueExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException("not an integer: " + v);
        }
    }

    /** Parses with {@code format}; values without an offset are taken as UTC, values with one are shifted to UTC. */
    public static OffsetDateTime toTimestamp(Object v, DateTimeFormatter format) {
        if (v instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC);
        if (v instanceof Instant i) return i.atOffset(ZoneOffset.UTC);
        if (v instanceof ZonedDateTime z) return z.withZoneSameInstant(ZoneOffset.UTC).toOffsetDateTime();
        if (v instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
        TemporalAccessor parsed = format.parseBest(v.toString().trim(), ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof ZonedDateTime z) return z.withZoneSameInstant(ZoneOffset.UTC).toOffsetDateTime();
        if (parsed instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
        return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    /** Canonical string form used to compare key values across batches and store listings. */
    public static String keyOf(Object v) {
        if (v == null) return null;
        if (v instanceof BigDecimal d) return d.stripTrailingZeros().toPlainString();
        if (v instanceof String s) return s.trim();
        return v.toString();
    }
}
