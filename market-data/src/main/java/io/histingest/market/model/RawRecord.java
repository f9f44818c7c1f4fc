package io.histingest.market.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record as delivered by the provider, before any interpretation.
 * <p>
 * Provider-native conventions: timestamps are epoch nanoseconds, integral prices are fixed-point
 * values in units of 1e-9 and {@link Long#MAX_VALUE} marks an undefined price. Decimal strings
 * and floating point numbers are taken at face value.
 */
public final class RawRecord {
    public static final String UNPARSED = "_raw";
    public static final String PARSE_ERROR = "_parse_error";

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static RawRecord of(Map<String, ?> fields) {
        return new RawRecord(new LinkedHashMap<>(fields));
    }

    /** A line the provider returned that could not be decoded at all. */
    public static RawRecord unparsable(String payload, String reason) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(UNPARSED, payload);
        m.put(PARSE_ERROR, reason);
        return new RawRecord(m);
    }

    public Object get(String field) { return fields.get(field); }

    public boolean has(String field) { return fields.get(field) != null; }

    public boolean isUnparsable() { return fields.containsKey(PARSE_ERROR); }

    public Map<String, Object> fields() { return fields; }

    @Override
    public String toString() { return "RawRecord" + fields; }
}
