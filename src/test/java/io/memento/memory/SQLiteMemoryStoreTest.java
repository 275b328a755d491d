package io.memento.memory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteMemoryStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private String dbPath;
    private SQLiteMemoryStore store;

    @BeforeEach
    void setUp() {
        dbPath = tempDir.resolve("acme.db").toString();
        store = new SQLiteMemoryStore(dbPath);
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static Memory memory(String id, String content, String... tags) {
        return Memory.of(id, content, "fact", List.of(tags), NOW.minus(Duration.ofHours(1)));
    }

    @Test
    void shouldStoreAndReadMemory() {
        Memory original = memory("abc12345", "Use Postgres 16", "DB", "infra")
                .withLinkages(List.of(Linkage.toFile("docs/adr-7.md", "decided-in"), Linkage.toMemory("def67890", "")));
        store.insert(original);

        Memory loaded = store.findById("abc12345").orElseThrow();

        assertEquals("Use Postgres 16", loaded.content());
        assertEquals("fact", loaded.type());
        assertEquals(List.of("db", "infra"), loaded.tags());
        assertEquals(original.createdAt(), loaded.createdAt());
        assertEquals(original.linkages(), loaded.linkages());
        assertFalse(loaded.consolidated());
        assertNull(loaded.embeddedAt());
    }

    @Test
    void shouldReturnEmptyForMissingId() {
        assertTrue(store.findById("nope0000").isEmpty());
    }

    @Test
    void shouldExcludeExpiredAndConsolidatedFromActive() {
        store.insert(memory("live0001", "live"));
        store.insert(memory("expired1", "expired").withExpiresAt(NOW.minus(Duration.ofMinutes(5))));
        store.insert(memory("later001", "expires later").withExpiresAt(NOW.plus(Duration.ofDays(1))));
        store.insert(memory("merged01", "merged").consolidatedInto("live0001"));

        List<String> active = store.findActive(NOW).stream().map(Memory::id).toList();

        assertEquals(2, active.size());
        assertTrue(active.containsAll(List.of("live0001", "later001")));
    }

    @Test
    void shouldFindActiveByIdsOnly() {
        store.insert(memory("aaaa0001", "a"));
        store.insert(memory("bbbb0001", "b").consolidatedInto("aaaa0001"));

        List<Memory> found = store.findActiveByIds(List.of("aaaa0001", "bbbb0001", "cccc0001", "aaaa0001"));

        assertEquals(1, found.size());
        assertEquals("aaaa0001", found.get(0).id());
        assertTrue(store.findActiveByIds(List.of()).isEmpty());
    }

    @Test
    void shouldRecordAccess() {
        store.insert(memory("aaaa0001", "a"));
        store.insert(memory("bbbb0001", "b"));

        store.recordAccess(List.of("aaaa0001"), "first query", NOW);
        store.recordAccess(List.of("aaaa0001", "bbbb0001"), "second query", NOW.plusSeconds(60));

        Memory a = store.findById("aaaa0001").orElseThrow();
        assertEquals(2, a.accessCount());
        assertEquals(NOW.plusSeconds(60), a.lastAccessedAt());
        assertEquals(1, store.findById("bbbb0001").orElseThrow().accessCount());
    }

    @Test
    void shouldUpdateRelevanceAndEmbeddedAt() {
        store.insert(memory("aaaa0001", "a"));

        store.updateRelevance("aaaa0001", 0.42);
        store.markEmbedded("aaaa0001", NOW);

        Memory loaded = store.findById("aaaa0001").orElseThrow();
        assertEquals(0.42, loaded.relevance(), 1e-9);
        assertEquals(NOW, loaded.embeddedAt());
        assertTrue(store.findUnembedded().isEmpty());
    }

    @Test
    void shouldStoreSettings() {
        assertEquals(Optional.empty(), store.findSetting("recall_alpha"));

        store.putSetting("recall_alpha", "0.3");
        store.putSetting("recall_alpha", "0.7");

        assertEquals(Optional.of("0.7"), store.findSetting("recall_alpha"));
    }

    @Test
    void shouldApplyConsolidationAtomically() {
        store.insert(memory("src00001", "one", "ops"));
        store.insert(memory("src00002", "two", "ops"));
        Memory merged = memory("mrg00001", "one and two", "ops")
                .withLinkages(List.of(Linkage.consolidatedFrom("src00001"), Linkage.consolidatedFrom("src00002")));
        Consolidation record = new Consolidation("mrg00001", "one and two", List.of("src00001", "src00002"),
                List.of("ops"), "fact", SummaryMethod.TEMPLATE, "template", NOW);

        store.applyConsolidation(merged, record, List.of("src00001", "src00002"));

        Memory source = store.findById("src00001").orElseThrow();
        assertTrue(source.consolidated());
        assertEquals("mrg00001", source.consolidatedInto());
        assertEquals(List.of("mrg00001"), store.findActive(NOW).stream().map(Memory::id).toList());

        List<Consolidation> consolidations = store.listConsolidations();
        assertEquals(1, consolidations.size());
        assertEquals(List.of("src00001", "src00002"), consolidations.get(0).sourceIds());
        assertEquals(SummaryMethod.TEMPLATE, consolidations.get(0).method());
        assertEquals("template", consolidations.get(0).templateSummary());
    }

    @Test
    void shouldRollBackConsolidationWhenSourceAlreadyConsolidated() {
        store.insert(memory("src00001", "one"));
        store.insert(memory("src00002", "two").consolidatedInto("elsewhere"));
        Memory merged = memory("mrg00001", "merged");
        Consolidation record = new Consolidation("mrg00001", "merged", List.of("src00001", "src00002"),
                List.of(), "fact", SummaryMethod.TEMPLATE, "merged", NOW);

        assertThrows(MemoryStoreException.class,
                () -> store.applyConsolidation(merged, record, List.of("src00001", "src00002")));

        assertTrue(store.findById("mrg00001").isEmpty());
        assertFalse(store.findById("src00001").orElseThrow().consolidated());
        assertTrue(store.listConsolidations().isEmpty());
    }

    @Test
    void shouldReactivateSourcesOfMissingMerge() {
        store.insert(memory("src00001", "orphan").consolidatedInto("ghost001"));
        store.insert(memory("src00002", "fine"));

        ReconcileReport report = store.reconcile();

        assertEquals(1, report.reactivated());
        assertEquals(0, report.completed());
        Memory reactivated = store.findById("src00001").orElseThrow();
        assertFalse(reactivated.consolidated());
        assertNull(reactivated.consolidatedInto());
    }

    @Test
    void shouldCompleteHalfWrittenMerge() {
        store.insert(memory("src00001", "one"));
        store.insert(memory("src00002", "two").consolidatedInto("mrg00001"));
        store.insert(memory("mrg00001", "merged")
                .withLinkages(List.of(Linkage.consolidatedFrom("src00001"), Linkage.consolidatedFrom("src00002"))));

        ReconcileReport report = store.reconcile();

        assertEquals(0, report.reactivated());
        assertEquals(1, report.completed());
        assertEquals("mrg00001", store.findById("src00001").orElseThrow().consolidatedInto());
        assertTrue(store.reconcile().isClean());
    }

    @Test
    void shouldCompleteMergeRecordedInConsolidations() throws SQLException {
        store.insert(memory("src00001", "one"));
        store.insert(memory("src00002", "two"));
        store.insert(memory("mrg00001", "merged"));
        store.close();
        try (var connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             var stmt = connection.createStatement()) {
            stmt.execute("""
                INSERT INTO consolidations (id, summary, source_ids, tags, type, method, created_at)
                VALUES ('mrg00001', 'merged', '["src00001","src00002"]', '[]', 'fact', 'template',
                        '2026-03-01T11:00:00.000Z')
                """);
        }
        store = new SQLiteMemoryStore(dbPath);
        store.init();

        ReconcileReport report = store.reconcile();

        assertEquals(2, report.completed());
        assertEquals("mrg00001", store.findById("src00001").orElseThrow().consolidatedInto());
        assertEquals("mrg00001", store.findById("src00002").orElseThrow().consolidatedInto());
        assertFalse(store.findById("mrg00001").orElseThrow().consolidated());
    }

    @Test
    void shouldIgnoreConsolidatedFromLabelWrittenByCaller() {
        store.insert(memory("target01", "still relevant"));
        store.insert(memory("note0001", "see target")
                .withLinkages(List.of(Linkage.toMemory("target01", Linkage.CONSOLIDATED_FROM))));

        ReconcileReport report = store.reconcile();

        assertEquals(0, report.completed());
        Memory target = store.findById("target01").orElseThrow();
        assertFalse(target.consolidated());
        assertNull(target.consolidatedInto());
    }

    @Test
    void shouldReadLegacyRowsWrittenWithoutNewColumns() throws SQLException {
        store.close();
        String legacyPath = tempDir.resolve("legacy.db").toString();
        try (var connection = DriverManager.getConnection("jdbc:sqlite:" + legacyPath);
             var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE memories (
                    id TEXT PRIMARY KEY, content TEXT NOT NULL, type TEXT DEFAULT 'observation',
                    tags TEXT DEFAULT '[]', created_at TEXT DEFAULT (datetime('now')), expires_at TEXT,
                    relevance REAL DEFAULT 1.0, access_count INTEGER DEFAULT 0, last_accessed_at TEXT,
                    consolidated INTEGER DEFAULT 0, consolidated_into TEXT)
                """);
            stmt.execute("""
                INSERT INTO memories (id, content, tags, created_at)
                VALUES ('old00001', 'legacy row', 'not json', '2025-12-01T08:30:00.000Z')
                """);
        }

        store = new SQLiteMemoryStore(legacyPath);
        store.init();

        Memory legacy = store.findById("old00001").orElseThrow();
        assertEquals("observation", legacy.type());
        assertTrue(legacy.tags().isEmpty());
        assertTrue(legacy.linkages().isEmpty());
        assertEquals(Instant.parse("2025-12-01T08:30:00Z"), legacy.createdAt());
        assertEquals(1, store.findUnembedded().size());
    }

    @Test
    void shouldPassHealthCheck() {
        assertTrue(store.healthCheck());
    }
}
