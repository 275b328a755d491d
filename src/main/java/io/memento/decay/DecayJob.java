package io.memento.decay;

import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import io.memento.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Recomputes the stored relevance of every active memory in a workspace.
 *
 * <p>Relevance = recency * accessBoost * lastAccessRecency, i.e. the query-free score from
 * {@link ScoringEngine}. A row is only written when its value moved by more than {@link #EPSILON}.
 * Rows are processed in batches of {@link #BATCH_SIZE}; a failing row is counted and skipped.</p>
 */
@Component
public class DecayJob {

    private static final Logger log = LoggerFactory.getLogger(DecayJob.class);

    static final double EPSILON = 1e-4;
    static final int BATCH_SIZE = 50;

    /**
     * Loads the active memories of the store and decays them.
     */
    public DecayResult applyDecay(MemoryStore store, Instant now) {
        return applyDecay(store, store.findActive(now), now);
    }

    /**
     * Decays the given memories, writing through {@code store}.
     *
     * @param store          the workspace store the memories came from
     * @param activeMemories active memories of that workspace; consolidated ones are ignored
     * @param now            reference time
     * @return number of rows updated and failed
     */
    public DecayResult applyDecay(MemoryStore store, List<Memory> activeMemories, Instant now) {
        int decayed = 0;
        int errors = 0;

        for (int start = 0; start < activeMemories.size(); start += BATCH_SIZE) {
            List<Memory> batch = activeMemories.subList(start, Math.min(start + BATCH_SIZE, activeMemories.size()));
            for (Memory memory : batch) {
                if (memory.consolidated()) continue;

                double relevance = ScoringEngine.scoreMemory(memory, List.of(), now);
                if (Math.abs(relevance - memory.relevance()) <= EPSILON) continue;

                try {
                    store.updateRelevance(memory.id(), relevance);
                    decayed++;
                } catch (RuntimeException e) {
                    log.error("Failed to update relevance of memory {}", memory.id(), e);
                    errors++;
                }
            }
        }

        log.info("Decay pass: {} of {} memories updated, {} errors", decayed, activeMemories.size(), errors);
        return new DecayResult(decayed, errors);
    }
}
