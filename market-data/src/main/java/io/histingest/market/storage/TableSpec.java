package io.histingest.market.storage;

import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.validate.IdempotencyKey;
import io.histingest.market.validate.SchemaRule;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Table layout for one schema: columns, the unique key and how a record maps to a row.
 *
 * @param row values of a record in column order
 */
public record TableSpec(String table, List<Column> columns, IdempotencyKey key, Function<CanonicalRecord, Object[]> row) {
    public static final String COLUMN_LIMIT = "column_limit";

    public TableSpec {
        columns = List.copyOf(columns);
        List<String> names = columns.stream().map(Column::name).collect(Collectors.toList());
        for (String k : key.columns()) {
            if (!names.contains(k)) throw new IllegalArgumentException(table + " has no key column " + k);
        }
    }

    /**
     * One rule per length- or precision-limited column, so a value the table would reject is
     * caught per record instead of failing the whole batch. Ids read {@code column_limit:<column>}.
     */
    public List<SchemaRule<CanonicalRecord>> columnLimitRules() {
        List<SchemaRule<CanonicalRecord>> rules = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            Column col = columns.get(i);
            if (!col.bounded()) continue;
            int idx = i;
            rules.add(SchemaRule.of(COLUMN_LIMIT + ":" + col.name(), col.limit(), CanonicalRecord.class,
                    r -> col.fits(row.apply(r)[idx])));
        }
        return rules;
    }

    public String createTableSql() {
        String cols = columns.stream().map(Column::ddl).collect(Collectors.joining(",\n    "));
        return "CREATE TABLE IF NOT EXISTS " + table + " (\n    " + cols
                + ",\n    created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP"
                + ",\n    CONSTRAINT uq_" + table + "_key UNIQUE (" + String.join(", ", key.columns()) + ")\n)";
    }

    /** Insert that skips rows whose key already exists. */
    public String insertSql() {
        String cols = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        String params = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + cols + ") VALUES (" + params + ") ON CONFLICT DO NOTHING";
    }

    public String hypertableSql() {
        return "SELECT create_hypertable('" + table + "', 'ts_event', if_not_exists => TRUE)";
    }

    public String timeIndexSql() {
        return "CREATE INDEX IF NOT EXISTS idx_" + table + "_instrument_time ON " + table + " (instrument_id, ts_event)";
    }
}
