package io.ledgersync.storage;

import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.model.CellKey;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.Variant;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link LedgerStore} over the SQLite tables created by {@link Database}.
 */
public final class SqliteLedgerStore implements LedgerStore {
    private final Database database;
    private final Map<String, EntityType> entities;

    public SqliteLedgerStore(Database database) {
        this.database = database;
        this.entities = new LinkedHashMap<>();
        for (EntityType entity : database.entities()) {
            entities.put(entity.dataset(), entity);
        }
    }

    @Override
    public Optional<EntityType> resolveDataset(String dataset) {
        return Optional.ofNullable(dataset == null ? null : entities.get(dataset));
    }

    @Override
    public Optional<ColumnDef> resolveColumn(String dataset, String name) {
        return resolveDataset(dataset).flatMap(entity -> entity.column(name));
    }

    @Override
    public LedgerTransaction begin() {
        try {
            Connection conn = database.openConnection();
            try {
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            return new SqliteTransaction(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to begin ledger transaction", e);
        }
    }

    @Override
    public ReplicaClock loadClock() {
        try (Connection c = database.openConnection()) {
            Optional<ReplicaClock> existing = readClock(c);
            if (existing.isPresent()) {
                return existing.get();
            }
            ReplicaClock created = ReplicaClock.create();
            writeClock(c, created);
            return created;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load replica clock", e);
        }
    }

    @Override
    public Optional<EntityRow> find(String dataset, String id) {
        EntityType entity = requireEntity(dataset);
        try (Connection c = database.openConnection()) {
            return readRow(c, entity, id);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read " + dataset + " row " + id, e);
        }
    }

    @Override
    public int cleanup() {
        int removed = 0;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                for (EntityType entity : entities.values()) {
                    if (!entity.hasColumn("tombstone")) {
                        continue;
                    }
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT OR IGNORE INTO messages_purged_rows(dataset,row_id) SELECT ?, id FROM "
                                    + entity.dataset() + " WHERE tombstone=1")) {
                        ps.setString(1, entity.dataset());
                        ps.executeUpdate();
                    }
                    try (PreparedStatement ps = c.prepareStatement(
                            "DELETE FROM " + entity.dataset() + " WHERE tombstone=1")) {
                        removed += ps.executeUpdate();
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clean up tombstoned rows", e);
        }
    }

    @Override
    public List<ChangeRecord> pendingOutgoing() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT timestamp,dataset,row_id,column_name,value_kind,value_text FROM messages_outbox ORDER BY timestamp")) {
            List<ChangeRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ChangeRecord(
                            rs.getString("dataset"),
                            rs.getString("row_id"),
                            rs.getString("column_name"),
                            Variant.parse(Variant.Kind.valueOf(rs.getString("value_kind")), rs.getString("value_text")),
                            LogicalTimestamp.parse(rs.getString("timestamp"))
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read outgoing records", e);
        }
    }

    @Override
    public void removeOutgoing(Collection<LogicalTimestamp> timestamps) {
        if (timestamps == null || timestamps.isEmpty()) {
            return;
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM messages_outbox WHERE timestamp=?")) {
                for (LogicalTimestamp timestamp : timestamps) {
                    ps.setString(1, timestamp.toString());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove outgoing records", e);
        }
    }

    private EntityType requireEntity(String dataset) {
        return resolveDataset(dataset)
                .orElseThrow(() -> new UnsupportedSchemaException("Unknown dataset: " + dataset));
    }

    private ColumnDef requireColumn(EntityType entity, String column) {
        return entity.column(column)
                .orElseThrow(() -> new UnsupportedSchemaException(
                        "Unknown column: " + entity.dataset() + "." + column));
    }

    private static Optional<ReplicaClock> readClock(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT client_id,last_timestamp,last_acknowledged FROM messages_clock WHERE id=1")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ReplicaClock(
                        rs.getString("client_id"),
                        LogicalTimestamp.parse(rs.getString("last_timestamp")),
                        LogicalTimestamp.parse(rs.getString("last_acknowledged"))
                ));
            }
        }
    }

    private static void writeClock(Connection c, ReplicaClock clock) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO messages_clock(id,client_id,last_timestamp,last_acknowledged,updated_at_ms)
                VALUES(1,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET
                    client_id=excluded.client_id,
                    last_timestamp=excluded.last_timestamp,
                    last_acknowledged=excluded.last_acknowledged,
                    updated_at_ms=excluded.updated_at_ms
                """)) {
            ps.setString(1, clock.clientId());
            ps.setString(2, clock.lastTimestamp().toString());
            ps.setString(3, clock.lastAcknowledged().toString());
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private static Optional<EntityRow> readRow(Connection c, EntityType entity, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT * FROM " + entity.dataset() + " WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(toRow(entity, rs));
            }
        }
    }

    private static EntityRow toRow(EntityType entity, ResultSet rs) throws SQLException {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (ColumnDef column : entity.columns()) {
            attributes.put(column.name(), normalize(rs.getObject(column.name())));
        }
        return new EntityRow(entity.dataset(), rs.getString("id"), attributes);
    }

    private static Object normalize(Object raw) {
        if (raw instanceof Integer i) {
            return i.longValue();
        }
        if (raw instanceof Float f) {
            return f.doubleValue();
        }
        return raw;
    }

    private final class SqliteTransaction implements LedgerTransaction {
        private final Connection conn;
        private boolean open = true;

        private SqliteTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public EntityRow getOrCreate(String dataset, String id) {
            EntityType entity = requireEntity(dataset);
            ensureOpen();
            try {
                insertIfMissing(entity, id);
                return readRow(conn, entity, id)
                        .orElseThrow(() -> new IllegalStateException("Row vanished after insert: " + dataset + "/" + id));
            } catch (SQLException e) {
                throw new RuntimeException("Failed to get or create " + dataset + " row " + id, e);
            }
        }

        @Override
        public Optional<EntityRow> find(String dataset, String id) {
            EntityType entity = requireEntity(dataset);
            ensureOpen();
            try {
                return readRow(conn, entity, id);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to read " + dataset + " row " + id, e);
            }
        }

        @Override
        public List<EntityRow> query(String dataset, Map<String, Object> equalsFilter) {
            EntityType entity = requireEntity(dataset);
            ensureOpen();
            StringBuilder sql = new StringBuilder("SELECT * FROM ").append(entity.dataset());
            List<Object> args = new ArrayList<>();
            if (equalsFilter != null && !equalsFilter.isEmpty()) {
                List<String> clauses = new ArrayList<>();
                for (Map.Entry<String, Object> e : equalsFilter.entrySet()) {
                    ColumnType type;
                    String name;
                    if ("id".equals(e.getKey())) {
                        type = ColumnType.TEXT;
                        name = "id";
                    } else {
                        ColumnDef column = requireColumn(entity, e.getKey());
                        type = column.type();
                        name = column.name();
                    }
                    Object bound = type.toSql(Variant.from(e.getValue()));
                    if (bound == null) {
                        clauses.add(Database.quote(name) + " IS NULL");
                    } else {
                        clauses.add(Database.quote(name) + "=?");
                        args.add(bound);
                    }
                }
                sql.append(" WHERE ").append(String.join(" AND ", clauses));
            }
            sql.append(" ORDER BY rowid");
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < args.size(); i++) {
                    ps.setObject(i + 1, args.get(i));
                }
                List<EntityRow> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(toRow(entity, rs));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to query " + dataset, e);
            }
        }

        @Override
        public void update(String dataset, String id, Map<String, Object> attributes) {
            EntityType entity = requireEntity(dataset);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("row id must not be blank");
            }
            ensureOpen();
            List<ColumnDef> columns = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            if (attributes != null) {
                for (Map.Entry<String, Object> e : attributes.entrySet()) {
                    ColumnDef column = requireColumn(entity, e.getKey());
                    columns.add(column);
                    values.add(column.type().toSql(Variant.from(e.getValue())));
                }
            }
            try {
                insertIfMissing(entity, id);
                if (columns.isEmpty()) {
                    return;
                }
                List<String> assignments = new ArrayList<>();
                for (ColumnDef column : columns) {
                    assignments.add(Database.quote(column.name()) + "=?");
                }
                String sql = "UPDATE " + entity.dataset() + " SET " + String.join(",", assignments) + " WHERE id=?";
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (int i = 0; i < values.size(); i++) {
                        ps.setObject(i + 1, values.get(i));
                    }
                    ps.setString(values.size() + 1, id);
                    ps.executeUpdate();
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to update " + dataset + " row " + id, e);
            }
        }

        @Override
        public Optional<LogicalTimestamp> cellTimestamp(CellKey cell) {
            ensureOpen();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT timestamp FROM messages_crdt_cells WHERE dataset=? AND row_id=? AND column_name=?")) {
                ps.setString(1, cell.dataset());
                ps.setString(2, cell.row());
                ps.setString(3, cell.column());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(LogicalTimestamp.parse(rs.getString(1)));
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to read cell clock", e);
            }
        }

        @Override
        public void recordCellTimestamp(CellKey cell, LogicalTimestamp timestamp) {
            ensureOpen();
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO messages_crdt_cells(dataset,row_id,column_name,timestamp)
                    VALUES(?,?,?,?)
                    ON CONFLICT(dataset,row_id,column_name) DO UPDATE SET timestamp=excluded.timestamp
                    """)) {
                ps.setString(1, cell.dataset());
                ps.setString(2, cell.row());
                ps.setString(3, cell.column());
                ps.setString(4, timestamp.toString());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to record cell clock", e);
            }
        }

        @Override
        public void saveClock(ReplicaClock clock) {
            ensureOpen();
            try {
                writeClock(conn, clock);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to save replica clock", e);
            }
        }

        @Override
        public void enqueueOutgoing(List<ChangeRecord> records) {
            ensureOpen();
            if (records == null || records.isEmpty()) {
                return;
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT OR REPLACE INTO messages_outbox(timestamp,dataset,row_id,column_name,value_kind,value_text)
                    VALUES(?,?,?,?,?,?)
                    """)) {
                for (ChangeRecord record : records) {
                    ps.setString(1, record.timestamp().toString());
                    ps.setString(2, record.dataset());
                    ps.setString(3, record.row());
                    ps.setString(4, record.column());
                    ps.setString(5, record.value().kind().name());
                    ps.setString(6, record.value().asText());
                    ps.addBatch();
                }
                ps.executeBatch();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to queue outgoing records", e);
            }
        }

        @Override
        public void commit() {
            ensureOpen();
            try {
                conn.commit();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to commit ledger transaction", e);
            } finally {
                release(false);
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            if (open) {
                release(true);
            }
        }

        /**
         * Purged rows come back tombstoned, so a late write to one of their other columns does not
         * revive them. A newer write to {@code tombstone} itself still wins as usual.
         */
        private void insertIfMissing(EntityType entity, String id) throws SQLException {
            if (entity.hasColumn("tombstone")) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT OR IGNORE INTO " + entity.dataset() + "(id,tombstone) SELECT ?, 1"
                                + " WHERE EXISTS (SELECT 1 FROM messages_purged_rows WHERE dataset=? AND row_id=?)")) {
                    ps.setString(1, id);
                    ps.setString(2, entity.dataset());
                    ps.setString(3, id);
                    ps.executeUpdate();
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR IGNORE INTO " + entity.dataset() + "(id) VALUES(?)")) {
                ps.setString(1, id);
                ps.executeUpdate();
            }
        }

        private void ensureOpen() {
            if (!open) {
                throw new IllegalStateException("Ledger transaction is closed");
            }
        }

        private void release(boolean rollback) {
            open = false;
            try {
                if (rollback) {
                    conn.rollback();
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to roll back ledger transaction", e);
            } finally {
                try {
                    conn.close();
                } catch (SQLException e) {
                    throw new RuntimeException("Failed to close ledger connection", e);
                }
            }
        }
    }
}
