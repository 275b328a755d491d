package io.memento.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * SQLite-backed store for one workspace database file.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memories}: memory rows; tags and linkages as JSON text</li>
 *   <li>{@code consolidations}: merge audit records</li>
 *   <li>{@code workspace_settings}: key/value settings such as {@code recall_alpha}</li>
 *   <li>{@code access_log}: one row per retrieval</li>
 * </ul>
 *
 * <p>Files created by older versions are upgraded in place by adding the missing columns.</p>
 */
public class SQLiteMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);
    private static final int MAX_LOGGED_QUERY_LENGTH = 200;

    private static final String MEMORY_COLUMNS = """
            id, content, type, tags, created_at, expires_at, access_count, last_accessed_at,
            relevance, consolidated, consolidated_into, linkages, embedded_at
            """;

    private final String dbPath;
    private Connection connection;

    public SQLiteMemoryStore(String dbPath) {
        this.dbPath = dbPath;
    }

    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.debug("SQLiteMemoryStore opened at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store at {}", dbPath, e);
            throw new MemoryStoreException("Memory store initialization failed: " + dbPath, e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id TEXT PRIMARY KEY,
                    content TEXT NOT NULL,
                    type TEXT DEFAULT 'observation',
                    tags TEXT DEFAULT '[]',
                    created_at TEXT DEFAULT (datetime('now')),
                    expires_at TEXT,
                    relevance REAL DEFAULT 1.0,
                    access_count INTEGER DEFAULT 0,
                    last_accessed_at TEXT,
                    consolidated INTEGER DEFAULT 0,
                    consolidated_into TEXT
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS consolidations (
                    id TEXT PRIMARY KEY,
                    summary TEXT NOT NULL,
                    source_ids TEXT DEFAULT '[]',
                    tags TEXT DEFAULT '[]',
                    type TEXT DEFAULT 'auto',
                    created_at TEXT DEFAULT (datetime('now'))
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS workspace_settings (
                    key TEXT PRIMARY KEY,
                    value TEXT
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS access_log (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    memory_id TEXT NOT NULL REFERENCES memories(id),
                    accessed_at TEXT DEFAULT (datetime('now')),
                    query TEXT
                )
                """);
        }

        addColumnIfMissing("memories", "linkages", "TEXT DEFAULT '[]'");
        addColumnIfMissing("memories", "embedded_at", "TEXT");
        addColumnIfMissing("consolidations", "method", "TEXT DEFAULT 'template'");
        addColumnIfMissing("consolidations", "template_summary", "TEXT");

        try (var stmt = connection.createStatement()) {
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_consolidated ON memories(consolidated)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_consolidated_into ON memories(consolidated_into)");
        }
    }

    private void addColumnIfMissing(String table, String column, String definition) throws SQLException {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) {
                    return;
                }
            }
        }
        try (var stmt = connection.createStatement()) {
            stmt.execute("ALTER TABLE %s ADD COLUMN %s %s".formatted(table, column, definition));
            log.info("Upgraded {}: added column {}.{}", dbPath, table, column);
        }
    }

    @Override
    public List<Memory> findActive(Instant now) {
        String sql = "SELECT " + MEMORY_COLUMNS + """
                FROM memories
                WHERE consolidated = 0
                ORDER BY created_at DESC
                """;
        List<Memory> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                Memory memory = toMemory(rs);
                // expires_at is stored in two text formats, so expiry is checked after parsing
                if (memory.isActive(now)) {
                    results.add(memory);
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to load active memories from " + dbPath, e);
        }
        return results;
    }

    @Override
    public List<Memory> findActiveByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        StringJoiner placeholders = new StringJoiner(", ");
        distinct.forEach(id -> placeholders.add("?"));

        String sql = "SELECT " + MEMORY_COLUMNS
                + " FROM memories WHERE id IN (" + placeholders + ") AND consolidated = 0";
        List<Memory> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < distinct.size(); i++) {
                stmt.setString(i + 1, distinct.get(i));
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toMemory(rs));
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to load memories by id from " + dbPath, e);
        }
        return results;
    }

    @Override
    public Optional<Memory> findById(String id) {
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM memories WHERE id = ?";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toMemory(rs));
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to get memory " + id, e);
        }
        return Optional.empty();
    }

    @Override
    public List<Memory> findUnembedded() {
        String sql = "SELECT " + MEMORY_COLUMNS + """
                FROM memories
                WHERE embedded_at IS NULL AND consolidated = 0
                ORDER BY created_at DESC
                """;
        List<Memory> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                results.add(toMemory(rs));
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to load unembedded memories from " + dbPath, e);
        }
        return results;
    }

    @Override
    public void insert(Memory memory) {
        try {
            insertMemory(memory);
            log.debug("Stored memory: id='{}', type={}", memory.id(), memory.type());
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to store memory " + memory.id(), e);
        }
    }

    @Override
    public void updateRelevance(String id, double relevance) {
        executeUpdate("UPDATE memories SET relevance = ? WHERE id = ?", "update relevance of " + id,
                stmt -> {
                    stmt.setDouble(1, relevance);
                    stmt.setString(2, id);
                });
    }

    @Override
    public void markEmbedded(String id, Instant embeddedAt) {
        executeUpdate("UPDATE memories SET embedded_at = ? WHERE id = ?", "mark " + id + " embedded",
                stmt -> {
                    stmt.setString(1, Timestamps.format(embeddedAt));
                    stmt.setString(2, id);
                });
    }

    @Override
    public void recordAccess(Collection<String> ids, String query, Instant accessedAt) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        String at = Timestamps.format(accessedAt);
        String loggedQuery = query == null ? null
                : query.substring(0, Math.min(MAX_LOGGED_QUERY_LENGTH, query.length()));
        inTransaction("record access", () -> {
            try (var update = connection.prepareStatement(
                    "UPDATE memories SET access_count = access_count + 1, last_accessed_at = ? WHERE id = ?");
                 var logRow = connection.prepareStatement(
                         "INSERT INTO access_log (memory_id, accessed_at, query) VALUES (?, ?, ?)")) {
                for (String id : ids) {
                    update.setString(1, at);
                    update.setString(2, id);
                    update.executeUpdate();

                    logRow.setString(1, id);
                    logRow.setString(2, at);
                    logRow.setString(3, loggedQuery);
                    logRow.executeUpdate();
                }
            }
        });
    }

    @Override
    public Optional<String> findSetting(String key) {
        try (var stmt = connection.prepareStatement("SELECT value FROM workspace_settings WHERE key = ?")) {
            stmt.setString(1, key);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to read setting " + key, e);
        }
        return Optional.empty();
    }

    @Override
    public void putSetting(String key, String value) {
        executeUpdate("""
                INSERT INTO workspace_settings (key, value) VALUES (?, ?)
                ON CONFLICT(key) DO UPDATE SET value = excluded.value
                """, "write setting " + key, stmt -> {
            stmt.setString(1, key);
            stmt.setString(2, value);
        });
    }

    @Override
    public void applyConsolidation(Memory merged, Consolidation consolidation, List<String> sourceIds) {
        inTransaction("consolidate into " + merged.id(), () -> {
            insertMemory(merged);
            insertConsolidation(consolidation);
            try (var stmt = connection.prepareStatement(
                    "UPDATE memories SET consolidated = 1, consolidated_into = ? WHERE id = ? AND consolidated = 0")) {
                for (String sourceId : sourceIds) {
                    stmt.setString(1, merged.id());
                    stmt.setString(2, sourceId);
                    if (stmt.executeUpdate() != 1) {
                        throw new SQLException("Source memory is missing or already consolidated: " + sourceId);
                    }
                }
            }
        });
        log.debug("Consolidated {} memories into {}", sourceIds.size(), merged.id());
    }

    @Override
    public List<Consolidation> listConsolidations() {
        String sql = """
                SELECT id, summary, source_ids, tags, type, method, template_summary, created_at
                FROM consolidations
                ORDER BY created_at
                """;
        List<Consolidation> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                results.add(new Consolidation(
                        rs.getString("id"),
                        rs.getString("summary"),
                        MemoryJsonCodec.parseStrings(rs.getString("source_ids")),
                        MemoryJsonCodec.parseStrings(rs.getString("tags")),
                        rs.getString("type"),
                        SummaryMethod.fromString(rs.getString("method")),
                        rs.getString("template_summary"),
                        Timestamps.parse(rs.getString("created_at"))
                ));
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to list consolidations from " + dbPath, e);
        }
        return results;
    }

    @Override
    public ReconcileReport reconcile() {
        int[] counts = new int[2];
        inTransaction("reconcile", () -> {
            try (var stmt = connection.prepareStatement("""
                    UPDATE memories SET consolidated = 0, consolidated_into = NULL
                    WHERE consolidated = 1
                      AND (consolidated_into IS NULL
                           OR (consolidated_into NOT IN (SELECT id FROM memories)
                               AND consolidated_into NOT IN (SELECT id FROM consolidations)))
                    """)) {
                counts[0] = stmt.executeUpdate();
            }
            counts[1] = completePartialMerges();
        });
        ReconcileReport report = new ReconcileReport(counts[0], counts[1]);
        if (!report.isClean()) {
            log.warn("Reconciled {}: {} orphaned sources reactivated, {} pending sources consolidated",
                    dbPath, report.reactivated(), report.completed());
        }
        return report;
    }

    private int completePartialMerges() throws SQLException {
        // a consolidation record names every source of its merge
        List<String[]> pending = new ArrayList<>();
        try (var stmt = connection.prepareStatement("SELECT id, source_ids FROM consolidations");
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                String mergedId = rs.getString("id");
                for (String sourceId : MemoryJsonCodec.parseStrings(rs.getString("source_ids"))) {
                    if (!sourceId.equals(mergedId)) {
                        pending.add(new String[]{mergedId, sourceId});
                    }
                }
            }
        }
        // without a record, consolidated-from linkages count only once a source already points at the merge
        try (var stmt = connection.prepareStatement("""
                SELECT id, linkages FROM memories
                WHERE linkages LIKE '%consolidated-from%'
                  AND id NOT IN (SELECT id FROM consolidations)
                  AND id IN (SELECT consolidated_into FROM memories
                             WHERE consolidated = 1 AND consolidated_into IS NOT NULL)
                """);
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                String mergedId = rs.getString("id");
                for (Linkage linkage : MemoryJsonCodec.parseLinkages(rs.getString("linkages"))) {
                    if (linkage.isConsolidatedFrom() && !linkage.ref().equals(mergedId)) {
                        pending.add(new String[]{mergedId, linkage.ref()});
                    }
                }
            }
        }
        Set<String> flipped = new HashSet<>();
        try (var stmt = connection.prepareStatement(
                "UPDATE memories SET consolidated = 1, consolidated_into = ? WHERE id = ? AND consolidated = 0")) {
            for (String[] pair : pending) {
                // a memory flipped in this sweep cannot absorb sources: keeps consolidated_into acyclic
                if (flipped.contains(pair[1]) || flipped.contains(pair[0])) continue;
                stmt.setString(1, pair[0]);
                stmt.setString(2, pair[1]);
                if (stmt.executeUpdate() > 0) {
                    flipped.add(pair[1]);
                }
            }
        }
        return flipped.size();
    }

    @Override
    public boolean healthCheck() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public void close() {
        if (connection != null) {
            try {
                connection.close();
                log.debug("SQLiteMemoryStore closed: {}", dbPath);
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection for {}", dbPath, e);
            }
        }
    }

    public String getDbPath() {
        return dbPath;
    }

    private void insertMemory(Memory memory) throws SQLException {
        String sql = """
                INSERT INTO memories (%s)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(MEMORY_COLUMNS);
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, memory.id());
            stmt.setString(2, memory.content());
            stmt.setString(3, memory.type());
            stmt.setString(4, MemoryJsonCodec.writeStrings(memory.tags()));
            setTimestamp(stmt, 5, memory.createdAt() != null ? memory.createdAt() : Instant.now());
            setTimestamp(stmt, 6, memory.expiresAt());
            stmt.setInt(7, memory.accessCount());
            setTimestamp(stmt, 8, memory.lastAccessedAt());
            stmt.setDouble(9, memory.relevance());
            stmt.setInt(10, memory.consolidated() ? 1 : 0);
            stmt.setString(11, memory.consolidatedInto());
            stmt.setString(12, MemoryJsonCodec.writeLinkages(memory.linkages()));
            setTimestamp(stmt, 13, memory.embeddedAt());
            stmt.executeUpdate();
        }
    }

    private void insertConsolidation(Consolidation consolidation) throws SQLException {
        String sql = """
                INSERT INTO consolidations (id, summary, source_ids, tags, type, method, template_summary, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, consolidation.id());
            stmt.setString(2, consolidation.summary());
            stmt.setString(3, MemoryJsonCodec.writeStrings(consolidation.sourceIds()));
            stmt.setString(4, MemoryJsonCodec.writeStrings(consolidation.tags()));
            stmt.setString(5, consolidation.type());
            stmt.setString(6, consolidation.method().wireName());
            stmt.setString(7, consolidation.templateSummary());
            setTimestamp(stmt, 8, consolidation.createdAt() != null ? consolidation.createdAt() : Instant.now());
            stmt.executeUpdate();
        }
    }

    private static void setTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, Timestamps.format(value));
        }
    }

    private Memory toMemory(ResultSet rs) throws SQLException {
        double relevance = rs.getDouble("relevance");
        if (rs.wasNull()) {
            relevance = Memory.DEFAULT_RELEVANCE;
        }
        return new Memory(
                rs.getString("id"),
                rs.getString("content"),
                rs.getString("type"),
                MemoryJsonCodec.parseStrings(rs.getString("tags")),
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("expires_at")),
                rs.getInt("access_count"),
                Timestamps.parse(rs.getString("last_accessed_at")),
                relevance,
                rs.getInt("consolidated") != 0,
                rs.getString("consolidated_into"),
                MemoryJsonCodec.parseLinkages(rs.getString("linkages")),
                Timestamps.parse(rs.getString("embedded_at"))
        );
    }

    private void executeUpdate(String sql, String action, StatementBinder binder) {
        try (var stmt = connection.prepareStatement(sql)) {
            binder.bind(stmt);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to " + action, e);
        }
    }

    private void inTransaction(String action, SqlWork work) {
        try {
            connection.setAutoCommit(false);
            try {
                work.run();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to " + action + " in " + dbPath, e);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }
}
