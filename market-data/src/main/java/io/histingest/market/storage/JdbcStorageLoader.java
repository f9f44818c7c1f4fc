package io.histingest.market.storage;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.histingest.core.PipelineError;
import io.histingest.core.Result;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.schema.SchemaRef;
import io.histingest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Inserts records in one transaction per call with {@code ON CONFLICT DO NOTHING} against the
 * table's unique key, so repeating a call leaves the table unchanged.
 */
public class JdbcStorageLoader implements StorageLoader {
    private static final Logger log = LoggerFactory.getLogger(JdbcStorageLoader.class);

    private final DataSource dataSource;
    private final int batchSize;
    private final Timer storeTimer;
    private final Meter inserted;
    private final Meter present;

    public JdbcStorageLoader(DataSource dataSource, Metrics metrics) {
        this(dataSource, metrics, 1_000);
    }

    public JdbcStorageLoader(DataSource dataSource, Metrics metrics, int batchSize) {
        this.dataSource = dataSource;
        this.batchSize = Math.max(1, batchSize);
        this.storeTimer = metrics.timer("storage.batch.time");
        this.inserted = metrics.meter("storage.rows.inserted");
        this.present = metrics.meter("storage.rows.present");
    }

    @Override
    public Result<StoreCounts> store(List<CanonicalRecord> records, SchemaRef schema) {
        if (records == null || records.isEmpty()) return Result.ok(StoreCounts.NONE);
        TableSpec spec = TableSpecs.forSchema(schema.type());
        try (Timer.Context ignored = storeTimer.time();
             Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            int newRows = 0;
            try (PreparedStatement ps = c.prepareStatement(spec.insertSql())) {
                int pending = 0;
                for (CanonicalRecord r : records) {
                    bind(ps, spec, r);
                    ps.addBatch();
                    if (++pending == batchSize) {
                        newRows += countInserted(ps.executeBatch());
                        pending = 0;
                    }
                }
                if (pending > 0) newRows += countInserted(ps.executeBatch());
                c.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(c);
                throw e;
            }
            StoreCounts counts = new StoreCounts(records.size(), newRows, records.size() - newRows);
            inserted.mark(counts.inserted());
            present.mark(counts.alreadyPresent());
            log.debug("Stored {} {} records into {} ({} new)", records.size(), schema, spec.table(), newRows);
            return Result.ok(counts);
        } catch (SQLException e) {
            PipelineError error = SqlErrors.classify(e);
            log.error("Failed to store {} {} records into {}: {}", records.size(), schema, spec.table(), e.getMessage());
            return Result.err(error);
        }
    }

    private static void bind(PreparedStatement ps, TableSpec spec, CanonicalRecord r) throws SQLException {
        Object[] values = spec.row().apply(r);
        List<Column> columns = spec.columns();
        if (values.length != columns.size()) {
            throw new IllegalStateException(spec.table() + " row has " + values.length + " values for " + columns.size() + " columns");
        }
        for (int i = 0; i < values.length; i++) {
            Object v = values[i];
            int idx = i + 1;
            if (v == null) {
                ps.setNull(idx, columns.get(i).jdbcType());
            } else if (v instanceof Instant) {
                ps.setObject(idx, ((Instant) v).atOffset(ZoneOffset.UTC));
            } else if (v instanceof BigDecimal) {
                ps.setBigDecimal(idx, columns.get(i).rounded((BigDecimal) v));
            } else if (v instanceof Long) {
                ps.setLong(idx, (Long) v);
            } else if (v instanceof Integer) {
                ps.setInt(idx, (Integer) v);
            } else if (v instanceof Boolean) {
                ps.setBoolean(idx, (Boolean) v);
            } else {
                ps.setString(idx, v.toString());
            }
        }
    }

    /** Rows skipped by ON CONFLICT report 0; drivers that cannot tell report SUCCESS_NO_INFO. */
    private static int countInserted(int[] results) {
        int n = 0;
        for (int r : results) {
            if (r > 0 || r == Statement.SUCCESS_NO_INFO) n++;
        }
        return n;
    }

    private static void rollbackQuietly(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
