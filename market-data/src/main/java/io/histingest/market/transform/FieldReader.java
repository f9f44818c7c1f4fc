package io.histingest.market.transform;

import io.histingest.market.model.RawRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Typed access to provider fields. Each lookup accepts a list of aliases and uses the first
 * one present.
 */
final class FieldReader {
    static final long UNDEF_PRICE = Long.MAX_VALUE;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final RawRecord raw;

    FieldReader(RawRecord raw) {
        this.raw = raw;
    }

    private Object find(String... names) {
        for (String n : names) {
            Object v = raw.get(n);
            if (v != null) return v;
        }
        return null;
    }

    private static FieldException missing(String[] names) {
        return new FieldException("missing_field:" + names[0], "required field '" + names[0] + "' is missing");
    }

    long requireLong(String... names) {
        Long v = optLong(names);
        if (v == null) throw missing(names);
        return v;
    }

    Long optLong(String... names) {
        Object v = find(names);
        if (v == null) return null;
        try {
            if (v instanceof BigDecimal) return ((BigDecimal) v).longValueExact();
            if (v instanceof BigInteger) return ((BigInteger) v).longValueExact();
            if (v instanceof Double || v instanceof Float) return new BigDecimal(v.toString()).longValueExact();
            if (v instanceof Number) return ((Number) v).longValue();
            if (v instanceof String) return Long.parseLong(((String) v).trim());
        } catch (ArithmeticException | NumberFormatException e) {
            throw new FieldException("invalid_integer:" + names[0], "field '" + names[0] + "' is not an integer: " + v);
        }
        throw new FieldException("invalid_integer:" + names[0], "field '" + names[0] + "' is not an integer: " + v);
    }

    Integer optInt(String... names) {
        Long v = optLong(names);
        if (v == null) return null;
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) {
            throw new FieldException("invalid_integer:" + names[0], "field '" + names[0] + "' out of range: " + v);
        }
        return v.intValue();
    }

    BigDecimal requirePrice(String... names) {
        BigDecimal v = optPrice(names);
        if (v == null) throw missing(names);
        return v;
    }

    /**
     * Integral values are fixed-point nanounits; {@link #UNDEF_PRICE} reads as absent.
     */
    BigDecimal optPrice(String... names) {
        Object v = find(names);
        if (v == null) return null;
        try {
            if (v instanceof Long || v instanceof Integer || v instanceof Short) {
                long fixed = ((Number) v).longValue();
                if (fixed == UNDEF_PRICE) return null;
                return BigDecimal.valueOf(fixed, 9).stripTrailingZeros();
            }
            if (v instanceof BigInteger) {
                BigInteger b = (BigInteger) v;
                if (b.bitLength() > 63) return null;
                return new BigDecimal(b, 9).stripTrailingZeros();
            }
            if (v instanceof BigDecimal) return (BigDecimal) v;
            if (v instanceof Double || v instanceof Float) {
                double d = ((Number) v).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new FieldException("invalid_number:" + names[0], "field '" + names[0] + "' is not finite");
                }
                return new BigDecimal(v.toString());
            }
            if (v instanceof String) {
                String s = ((String) v).trim();
                if (s.isEmpty()) return null;
                return new BigDecimal(s);
            }
        } catch (NumberFormatException e) {
            throw new FieldException("invalid_number:" + names[0], "field '" + names[0] + "' is not a number: " + v);
        }
        throw new FieldException("invalid_number:" + names[0], "field '" + names[0] + "' is not a number: " + v);
    }

    Instant requireTimestamp(String... names) {
        Instant v = optTimestamp(names);
        if (v == null) throw missing(names);
        return v;
    }

    /**
     * Integral values are epoch nanoseconds; strings may be ISO-8601 instants, offset date-times,
     * plain dates (midnight UTC) or digit strings (nanoseconds).
     */
    Instant optTimestamp(String... names) {
        Object v = find(names);
        if (v == null) return null;
        if (v instanceof BigInteger) {
            BigInteger b = (BigInteger) v;
            if (b.bitLength() > 63) return null;
            return fromNanos(b.longValue());
        }
        if (v instanceof Long || v instanceof Integer) {
            long n = ((Number) v).longValue();
            if (n == Long.MAX_VALUE) return null;
            return fromNanos(n);
        }
        if (v instanceof String) {
            String s = ((String) v).trim();
            if (s.isEmpty()) return null;
            try {
                if (s.chars().allMatch(Character::isDigit)) return fromNanos(Long.parseLong(s));
                if (s.length() == 10) return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
                if (s.endsWith("Z")) return Instant.parse(s);
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new FieldException("invalid_timestamp:" + names[0], "field '" + names[0] + "' is not a timestamp: " + v);
            }
        }
        throw new FieldException("invalid_timestamp:" + names[0], "field '" + names[0] + "' is not a timestamp: " + v);
    }

    String optString(String... names) {
        Object v = find(names);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /** Single-character codes such as side or action; numeric char codes are decoded. */
    String optCode(String... names) {
        Object v = find(names);
        if (v == null) return null;
        if (v instanceof Number) {
            int c = ((Number) v).intValue();
            if (c <= 0) return null;
            return String.valueOf((char) c);
        }
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    static Instant fromNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
