package io.histingest.market.storage;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * @param jdbcType  {@link java.sql.Types} constant used when binding nulls
 * @param length    maximum characters of a VARCHAR column, 0 when unbounded
 * @param precision total digits of a DECIMAL column, 0 when unbounded
 * @param scale     fractional digits of a DECIMAL column; longer values are rounded on insert
 */
public record Column(String name, String sqlType, int jdbcType, boolean notNull, int length, int precision, int scale) {

    public Column(String name, String sqlType, int jdbcType, boolean notNull) {
        this(name, sqlType, jdbcType, notNull, 0, 0, 0);
    }

    public String ddl() {
        return name + " " + sqlType + (notNull ? " NOT NULL" : "");
    }

    public boolean bounded() {
        return length > 0 || precision > 0;
    }

    /** Whether the database would accept the value without truncation or numeric overflow. */
    public boolean fits(Object value) {
        if (value == null) return true;
        if (length > 0) {
            String s = value.toString();
            return s.codePointCount(0, s.length()) <= length;
        }
        if (precision > 0 && value instanceof BigDecimal) {
            return rounded((BigDecimal) value).precision() <= precision;
        }
        return true;
    }

    /** The value as stored, rounded to the column scale when it carries more digits. */
    public BigDecimal rounded(BigDecimal value) {
        return precision > 0 && value.scale() > scale ? value.setScale(scale, RoundingMode.HALF_UP) : value;
    }

    /** Why {@link #fits} rejects a value. */
    public String limit() {
        return length > 0 ? name + " longer than " + length + " characters" : name + " does not fit " + sqlType;
    }
}
