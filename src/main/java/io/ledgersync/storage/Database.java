package io.ledgersync.storage;

import io.ledgersync.config.LedgerSyncConfig;
import io.ledgersync.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "ledgersync.schema.migration.v1";
    private final LedgerSyncConfig config;
    private final String jdbcUrl;
    private final List<? extends EntityType> entities;

    public Database(LedgerSyncConfig config) {
        this(config, List.of(LedgerEntity.values()));
    }

    public Database(LedgerSyncConfig config, List<? extends EntityType> entities) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.entities = List.copyOf(entities);
    }

    public List<? extends EntityType> entities() {
        return entities;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            for (EntityType entity : entities) {
                st.execute("CREATE TABLE IF NOT EXISTS " + entity.dataset() + " (id TEXT PRIMARY KEY)");
                ensureEntityColumns(conn, entity);
                validateEntityColumns(conn, entity);
            }

            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages_clock (
                        id INTEGER PRIMARY KEY CHECK (id = 1),
                        client_id TEXT NOT NULL,
                        last_timestamp TEXT NOT NULL,
                        last_acknowledged TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages_crdt_cells (
                        dataset TEXT NOT NULL,
                        row_id TEXT NOT NULL,
                        column_name TEXT NOT NULL,
                        timestamp TEXT NOT NULL,
                        PRIMARY KEY(dataset, row_id, column_name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages_outbox (
                        timestamp TEXT PRIMARY KEY,
                        dataset TEXT NOT NULL,
                        row_id TEXT NOT NULL,
                        column_name TEXT NOT NULL,
                        value_kind TEXT NOT NULL,
                        value_text TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages_purged_rows (
                        dataset TEXT NOT NULL,
                        row_id TEXT NOT NULL,
                        PRIMARY KEY(dataset, row_id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private Map<String, String> tableColumns(Connection conn, String table) throws SQLException {
        Map<String, String> columns = new LinkedHashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                String type = rs.getString("type");
                columns.put(rs.getString("name").toLowerCase(Locale.ROOT),
                        type == null ? "" : type.toUpperCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private void ensureEntityColumns(Connection conn, EntityType entity) throws SQLException {
        Map<String, String> columns = tableColumns(conn, entity.dataset());
        try (Statement st = conn.createStatement()) {
            for (ColumnDef column : entity.columns()) {
                if (!columns.containsKey(column.name().toLowerCase(Locale.ROOT))) {
                    st.execute("ALTER TABLE " + entity.dataset() + " ADD COLUMN "
                            + quote(column.name()) + " " + column.type().sqlType());
                }
            }
        }
    }

    private void validateEntityColumns(Connection conn, EntityType entity) throws SQLException {
        Map<String, String> columns = tableColumns(conn, entity.dataset());
        if (!columns.containsKey("id")) {
            throw new UnsupportedSchemaException("Table " + entity.dataset() + " has no id column");
        }
        for (ColumnDef column : entity.columns()) {
            String actual = columns.get(column.name().toLowerCase(Locale.ROOT));
            if (actual == null) {
                throw new UnsupportedSchemaException("Column " + entity.dataset() + "." + column.name() + " is missing");
            }
            if (!actual.isEmpty() && !actual.equals(column.type().sqlType())) {
                throw new UnsupportedSchemaException(
                        "Column " + entity.dataset() + "." + column.name()
                                + " has type " + actual + ", expected " + column.type().sqlType()
                );
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        if (hasEntity(LedgerEntity.TRANSACTIONS)) {
            steps.add(new MigrationStep(
                    "20261019_001_transaction_lookup",
                    "Index transactions by account/date and imported financial id",
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_transactions_acct_date ON transactions(acct, date)",
                            "CREATE INDEX IF NOT EXISTS idx_transactions_financial_id ON transactions(financial_id)"
                    )
            ));
        }
        steps.add(new MigrationStep(
                "20261019_002_crdt_cell_rows",
                "Index cell clocks by row",
                List.of("CREATE INDEX IF NOT EXISTS idx_crdt_cells_row ON messages_crdt_cells(dataset, row_id)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean hasEntity(EntityType type) {
        for (EntityType entity : entities) {
            if (entity.dataset().equals(type.dataset())) {
                return true;
            }
        }
        return false;
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Hashing.sha256Hex(sb.toString()).substring(0, 16);
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = String.valueOf(rs.getString(1)).toLowerCase(Locale.ROOT);
            if (!expected.equals(actual)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
