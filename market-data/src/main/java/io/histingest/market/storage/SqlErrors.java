package io.histingest.market.storage;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Maps JDBC failures onto the storage error kinds. Connection loss, serialization failures,
 * deadlocks and admin shutdowns are transient; constraint and syntax errors are permanent.
 */
public final class SqlErrors {
    private SqlErrors() {}

    public static PipelineError classify(SQLException e) {
        String state = sqlState(e);
        boolean transientFailure = e instanceof SQLTransientException
                || e instanceof SQLRecoverableException
                || isTransientState(state);
        ErrorKind kind = transientFailure ? ErrorKind.STORAGE_TRANSIENT : ErrorKind.STORAGE_PERMANENT;
        String code = state == null ? "sql_error" : state;
        PipelineError error = PipelineError.of(kind, code, e.getMessage(), e);
        if (!transientFailure && state != null && state.startsWith("42")) {
            error = error.withRemediation("check that the target tables exist and match the expected layout");
        }
        return error;
    }

    static boolean isTransientState(String state) {
        if (state == null) return false;
        return state.startsWith("08")          // connection exception
                || state.equals("40001")       // serialization failure
                || state.equals("40P01")       // deadlock detected
                || state.equals("53300")       // too many connections
                || state.equals("57P01")       // admin shutdown
                || state.equals("57P03")       // cannot connect now
                || state.equals("HYT00");      // timeout
    }

    private static String sqlState(SQLException e) {
        SQLException cur = e;
        while (cur != null) {
            if (cur.getSQLState() != null) return cur.getSQLState();
            cur = cur.getNextException();
        }
        return null;
    }
}
