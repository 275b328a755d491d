package io.memento.embedding;

import java.util.List;
import java.util.Optional;

/**
 * Embedder used when no embedding model is configured. Every operation is a no-op.
 */
public class NoopEmbedder implements Embedder {

    @Override
    public Optional<float[]> embed(String text) {
        return Optional.empty();
    }

    @Override
    public boolean upsert(String workspaceId, String memoryId, float[] vector) {
        return false;
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK, String workspaceId) {
        return List.of();
    }

    @Override
    public boolean delete(String workspaceId, String memoryId) {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
