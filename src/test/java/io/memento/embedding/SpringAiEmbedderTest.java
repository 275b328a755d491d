package io.memento.embedding;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.embedding.EmbeddingModel;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringAiEmbedderTest {

    @TempDir
    Path tempDir;

    private EmbeddingModel model;
    private SpringAiEmbedder embedder;

    @BeforeEach
    void setUp() {
        model = mock(EmbeddingModel.class);
        embedder = new SpringAiEmbedder(model, tempDir.resolve("vectors.db").toString());
        embedder.init();
    }

    @AfterEach
    void tearDown() {
        embedder.close();
    }

    @Test
    void shouldReturnClosestVectorsOfOneWorkspace() {
        assertTrue(embedder.upsert("acme", "near0001", new float[]{1f, 0.1f, 0f}));
        assertTrue(embedder.upsert("acme", "far00001", new float[]{0f, 1f, 0f}));
        assertTrue(embedder.upsert("other", "near0001", new float[]{1f, 0f, 0f}));

        List<VectorMatch> matches = embedder.query(new float[]{1f, 0f, 0f}, 5, "acme");

        assertEquals(List.of("near0001", "far00001"), matches.stream().map(VectorMatch::id).toList());
        assertTrue(matches.get(0).score() > 0.99);
        assertEquals(0, matches.get(1).score(), 1e-6);
    }

    @Test
    void shouldReplaceVectorOnUpsert() {
        embedder.upsert("acme", "mem00001", new float[]{0f, 1f});
        embedder.upsert("acme", "mem00001", new float[]{1f, 0f});

        List<VectorMatch> matches = embedder.query(new float[]{1f, 0f}, 5, "acme");

        assertEquals(1, matches.size());
        assertEquals(1.0, matches.get(0).score(), 1e-6);
    }

    @Test
    void shouldSkipVectorsOfOtherDimensions() {
        embedder.upsert("acme", "old00001", new float[]{1f, 0f});
        embedder.upsert("acme", "new00001", new float[]{1f, 0f, 0f});

        List<VectorMatch> matches = embedder.query(new float[]{1f, 0f, 0f}, 5, "acme");

        assertEquals(List.of("new00001"), matches.stream().map(VectorMatch::id).toList());
    }

    @Test
    void shouldEmbedAndSearchThroughModel() {
        when(model.embed("postgres upgrade")).thenReturn(new float[]{0.6f, 0.8f});
        when(model.embed("database")).thenReturn(new float[]{0.6f, 0.8f});

        assertTrue(embedder.embedAndStore("acme", "pg000001", "postgres upgrade"));
        List<VectorMatch> matches = embedder.search("acme", "database", 3);

        assertEquals("pg000001", matches.get(0).id());
        assertEquals(1.0, matches.get(0).score(), 1e-6);
    }

    @Test
    void shouldNotCallModelForBlankText() {
        assertTrue(embedder.embed("  ").isEmpty());
        verifyNoInteractions(model);
    }

    @Test
    void shouldDeleteVector() {
        embedder.upsert("acme", "mem00001", new float[]{1f, 0f});

        assertTrue(embedder.delete("acme", "mem00001"));
        assertTrue(embedder.query(new float[]{1f, 0f}, 5, "acme").isEmpty());
    }

    @Test
    void shouldComputeCosine() {
        assertEquals(1.0, SpringAiEmbedder.cosine(new float[]{2f, 0f}, new float[]{5f, 0f}), 1e-9);
        assertEquals(-1.0, SpringAiEmbedder.cosine(new float[]{1f, 0f}, new float[]{-1f, 0f}), 1e-9);
        assertEquals(0.0, SpringAiEmbedder.cosine(new float[]{0f, 0f}, new float[]{1f, 0f}), 1e-9);
    }

    @Test
    void shouldNeverBeAvailableWhenNoop() {
        NoopEmbedder noop = new NoopEmbedder();

        assertFalse(noop.isAvailable());
        assertFalse(noop.embedAndStore("acme", "mem00001", "text"));
        assertTrue(noop.search("acme", "query", 5).isEmpty());
    }
}
