package io.memento.scoring;

import io.memento.config.MementoProperties;
import io.memento.embedding.Embedder;
import io.memento.embedding.VectorMatch;
import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import io.memento.memory.MemoryStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RecallServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MemoryStore store;
    private Embedder embedder;
    private RecallService recallService;

    private final Memory deploy = Memory.of("dep00001", "deploy with blue-green", "decision",
            List.of("ops"), NOW.minus(Duration.ofHours(2)));
    private final Memory lunch = Memory.of("lun00001", "team lunch on friday", "observation",
            List.of(), NOW.minus(Duration.ofHours(1)));
    private final Memory rollout = Memory.of("rol00001", "canary rollout plan", "fact",
            List.of("ops"), NOW.minus(Duration.ofHours(3)));

    @BeforeEach
    void setUp() {
        store = mock(MemoryStore.class);
        embedder = mock(Embedder.class);
        recallService = new RecallService(embedder, MementoProperties.defaults());

        when(store.findActive(NOW)).thenReturn(List.of(deploy, lunch, rollout));
    }

    @Test
    void shouldRankByKeywordWhenEmbeddingUnavailable() {
        when(embedder.isAvailable()).thenReturn(false);

        RecallResult result = recallService.recall(store, "acme", "deploy", NOW);

        assertFalse(result.hybrid());
        assertEquals(1, result.results().size());
        assertEquals("dep00001", result.results().get(0).memoryId());
        assertSame(deploy, result.results().get(0).memory());
        verify(store).recordAccess(List.of("dep00001"), "deploy", NOW);
        verify(embedder, never()).search(anyString(), anyString(), anyInt());
    }

    @Test
    void shouldResolveVectorOnlyHitsAndDropStaleOnes() {
        when(embedder.isAvailable()).thenReturn(true);
        when(embedder.search("acme", "deploy", 20)).thenReturn(List.of(
                new VectorMatch("rol00001", 0.9),
                new VectorMatch("stale001", 0.8)));
        when(store.findActiveByIds(anyCollection())).thenReturn(List.of(rollout));

        RecallResult result = recallService.recall(store, "acme", "deploy", NOW);

        assertTrue(result.hybrid());
        List<String> ids = result.results().stream().map(HybridResult::memoryId).toList();
        assertTrue(ids.containsAll(List.of("dep00001", "rol00001")));
        assertFalse(ids.contains("stale001"));
        result.results().forEach(r -> assertNotNull(r.memory()));
        verify(store).findActiveByIds(List.of("rol00001", "stale001"));
    }

    @Test
    void shouldFallBackToKeywordWhenVectorSearchFails() {
        when(embedder.isAvailable()).thenReturn(true);
        when(embedder.search(anyString(), anyString(), anyInt())).thenThrow(new IllegalStateException("quota"));

        RecallResult result = recallService.recall(store, "acme", "deploy", NOW);

        assertFalse(result.hybrid());
        assertEquals("dep00001", result.results().get(0).memoryId());
    }

    @Test
    void shouldReturnResultsWhenAccessRecordingFails() {
        when(embedder.isAvailable()).thenReturn(false);
        doThrow(new MemoryStoreException("disk full")).when(store).recordAccess(anyCollection(), anyString(), any());

        RecallResult result = recallService.recall(store, "acme", "ops", NOW);

        assertEquals(2, result.results().size());
    }

    @Test
    void shouldNotRecordAccessWhenNothingMatches() {
        when(embedder.isAvailable()).thenReturn(false);

        RecallResult result = recallService.recall(store, "acme", "kubernetes", NOW);

        assertTrue(result.isEmpty());
        verify(store, never()).recordAccess(anyCollection(), anyString(), any());
    }

    @Test
    void shouldUseWorkspaceAlphaWhenValid() {
        when(store.findSetting("recall_alpha")).thenReturn(Optional.of("0.8"));
        assertEquals(0.8, recallService.resolveAlpha(store), 1e-9);

        when(store.findSetting("recall_alpha")).thenReturn(Optional.of("not-a-number"));
        assertEquals(0.5, recallService.resolveAlpha(store), 1e-9);

        when(store.findSetting("recall_alpha")).thenReturn(Optional.of("1.5"));
        assertEquals(0.5, recallService.resolveAlpha(store), 1e-9);

        when(store.findSetting("recall_alpha")).thenReturn(Optional.empty());
        assertEquals(0.5, recallService.resolveAlpha(store), 1e-9);
    }
}
