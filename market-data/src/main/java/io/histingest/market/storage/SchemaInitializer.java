package io.histingest.market.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the market data tables when missing. With TimescaleDB enabled each table also
 * becomes a hypertable partitioned on {@code ts_event}.
 */
public class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private final DataSource dataSource;
    private final boolean timescale;

    public SchemaInitializer(DataSource dataSource, boolean timescale) {
        this.dataSource = dataSource;
        this.timescale = timescale;
    }

    public void initialize() throws SQLException {
        try (Connection c = dataSource.getConnection(); Statement s = c.createStatement()) {
            for (TableSpec spec : TableSpecs.all()) {
                s.execute(spec.createTableSql());
                s.execute(spec.timeIndexSql());
                if (timescale) s.execute(spec.hypertableSql());
                log.info("Ensured table {}", spec.table());
            }
        }
    }
}
