package io.memento.embedding;

import io.memento.config.MementoProperties;
import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Embeds every active memory of a workspace that is not yet in the vector index.
 *
 * <p>Rows are processed newest first, sequentially, in fixed-size batches to stay inside provider
 * rate limits. A failing row is counted and the run continues.</p>
 */
@Component
public class EmbeddingBackfillJob {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingBackfillJob.class);

    private final Embedder embedder;
    private final int batchSize;
    private final Clock clock;

    public EmbeddingBackfillJob(Embedder embedder, MementoProperties properties, Clock clock) {
        this.embedder = embedder;
        this.batchSize = properties.embedding().batchSize();
        this.clock = clock;
    }

    public BackfillResult backfill(MemoryStore store, String workspaceId) {
        if (!embedder.isAvailable()) {
            log.debug("Embedding unavailable, skipping backfill for workspace {}", workspaceId);
            return BackfillResult.empty();
        }

        List<Memory> rows = store.findUnembedded();
        int embedded = 0;
        int skipped = 0;
        int errors = 0;

        for (int start = 0; start < rows.size(); start += batchSize) {
            List<Memory> batch = rows.subList(start, Math.min(start + batchSize, rows.size()));
            log.debug("Backfilling batch of {} in workspace {} ({}/{})",
                    batch.size(), workspaceId, start + batch.size(), rows.size());

            for (Memory memory : batch) {
                if (memory.content().isBlank()) {
                    skipped++;
                    continue;
                }
                try {
                    if (embedder.embedAndStore(workspaceId, memory.id(), memory.content())) {
                        store.markEmbedded(memory.id(), clock.instant());
                        embedded++;
                    } else {
                        skipped++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to embed memory {} in workspace {}", memory.id(), workspaceId, e);
                    errors++;
                }
            }
        }

        log.info("Backfill for workspace {}: {} embedded, {} skipped, {} errors",
                workspaceId, embedded, skipped, errors);
        return new BackfillResult(embedded, skipped, errors);
    }
}
