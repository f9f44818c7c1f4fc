package io.histingest.market.storage;

/**
 * Database connection settings. {@code HISTINGEST_JDBC_URL} wins over the individual
 * {@code TIMESCALEDB_*} variables.
 */
public record StorageConfig(
        String jdbcUrl,
        String user,
        String password,
        int maxPoolSize,
        boolean timescale
) {
    public static StorageConfig fromEnv() {
        String host = read("timescaledb.host", "TIMESCALEDB_HOST", "localhost");
        String port = read("timescaledb.port", "TIMESCALEDB_PORT", "5432");
        String db = read("timescaledb.dbname", "TIMESCALEDB_DBNAME", "hist_data");
        String url = read("histingest.jdbc.url", "HISTINGEST_JDBC_URL", "jdbc:postgresql://" + host + ":" + port + "/" + db);
        String user = read("timescaledb.user", "TIMESCALEDB_USER", "postgres");
        String password = read("timescaledb.password", "TIMESCALEDB_PASSWORD", "");
        int pool = Integer.parseInt(read("histingest.db.pool", "HISTINGEST_DB_POOL", "10"));
        boolean timescale = Boolean.parseBoolean(read("histingest.timescale", "HISTINGEST_TIMESCALE", "true"));
        return new StorageConfig(url, user, password, pool, timescale);
    }

    private static String read(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    @Override
    public String toString() {
        return "StorageConfig{jdbcUrl=" + jdbcUrl + ", user=" + user + ", maxPoolSize=" + maxPoolSize + ", timescale=" + timescale + "}";
    }
}
