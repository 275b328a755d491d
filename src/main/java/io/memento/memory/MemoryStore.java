package io.memento.memory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for the memories of one workspace.
 *
 * <p>Every instance is bound to exactly one workspace, so callers can never mix rows from different
 * workspaces. Write failures surface as {@link MemoryStoreException}.</p>
 */
public interface MemoryStore extends AutoCloseable {

    /**
     * Returns all memories that are not consolidated and not expired at {@code now}, newest first.
     */
    List<Memory> findActive(Instant now);

    /**
     * Returns the non-consolidated memories among {@code ids}. Unknown and consolidated ids are
     * simply absent from the result.
     *
     * @param ids the ids to look up
     * @return matching active memories, in no particular order
     */
    List<Memory> findActiveByIds(Collection<String> ids);

    /**
     * Gets a memory by id, consolidated or not.
     */
    Optional<Memory> findById(String id);

    /**
     * Returns non-consolidated memories that have never been stored in the vector index, newest first.
     */
    List<Memory> findUnembedded();

    void insert(Memory memory);

    void updateRelevance(String id, double relevance);

    void markEmbedded(String id, Instant embeddedAt);

    /**
     * Increments the access count and sets the last access time of each memory, and appends one
     * access log row per memory.
     *
     * @param ids        retrieved memory ids
     * @param query      the query that retrieved them, stored truncated
     * @param accessedAt access time
     */
    void recordAccess(Collection<String> ids, String query, Instant accessedAt);

    Optional<String> findSetting(String key);

    void putSetting(String key, String value);

    /**
     * Persists a merge as one unit: inserts the merged memory and its consolidation record, then
     * marks every source as consolidated into the merged memory. If any source is already
     * consolidated or missing, nothing is written.
     *
     * @param merged        the new active memory
     * @param consolidation the audit record, sharing the merged memory's id
     * @param sourceIds     ids of the memories being merged
     * @throws MemoryStoreException if the merge could not be committed
     */
    void applyConsolidation(Memory merged, Consolidation consolidation, List<String> sourceIds);

    List<Consolidation> listConsolidations();

    /**
     * Repairs merges left half-written by a writer that did not use {@link #applyConsolidation}.
     */
    ReconcileReport reconcile();

    /**
     * Health check: verifies the store is operational.
     */
    boolean healthCheck();

    @Override
    void close();
}
