package io.memento.embedding;

import java.util.List;
import java.util.Optional;

/**
 * Vector embedding and similarity search for memories.
 *
 * <p>Implementations are optional collaborators. When embedding is unavailable every operation
 * degrades to an empty or {@code false} result instead of throwing; see {@link NoopEmbedder}.</p>
 */
public interface Embedder {

    /**
     * Embeds text into a vector.
     *
     * @return the vector, or empty when embedding is unavailable
     */
    Optional<float[]> embed(String text);

    /**
     * Stores the vector of a memory, replacing any previous one.
     *
     * @return true if stored
     */
    boolean upsert(String workspaceId, String memoryId, float[] vector);

    /**
     * Finds the memories of one workspace closest to a vector.
     *
     * @param vector      query vector
     * @param topK        maximum number of matches
     * @param workspaceId only vectors of this workspace are considered
     * @return matches, best first
     */
    List<VectorMatch> query(float[] vector, int topK, String workspaceId);

    /**
     * Removes the vector of a memory.
     *
     * @return true if the index was reachable
     */
    boolean delete(String workspaceId, String memoryId);

    /**
     * Whether embeddings are actually produced.
     */
    boolean isAvailable();

    /**
     * Embeds content and stores it for the memory.
     *
     * @return true if a vector was stored
     */
    default boolean embedAndStore(String workspaceId, String memoryId, String content) {
        return embed(content)
                .map(vector -> upsert(workspaceId, memoryId, vector))
                .orElse(false);
    }

    /**
     * Embeds a natural-language query and searches the workspace.
     */
    default List<VectorMatch> search(String workspaceId, String query, int topK) {
        return embed(query)
                .map(vector -> query(vector, topK, workspaceId))
                .orElse(List.of());
    }
}
