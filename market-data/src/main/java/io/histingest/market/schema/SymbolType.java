package io.histingest.market.schema;

import java.util.Locale;

/**
 * How the requested symbols are interpreted by the provider.
 */
public enum SymbolType {
    CONTINUOUS("continuous"),
    PARENT("parent"),
    RAW_SYMBOL("raw_symbol"),
    INSTRUMENT_ID("instrument_id");

    private final String wireName;

    SymbolType(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    public static SymbolType parse(String s) {
        String n = s.trim().toLowerCase(Locale.ROOT);
        for (SymbolType t : values()) {
            if (t.wireName.equals(n)) return t;
        }
        throw new IllegalArgumentException("unknown symbol type '" + s + "'");
    }
}
