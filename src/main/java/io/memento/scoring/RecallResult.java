package io.memento.scoring;

import java.util.List;

/**
 * Ranked memories returned by a recall.
 *
 * @param results ranked results, every one carrying its memory
 * @param hybrid  whether vector scores took part in the ranking
 */
public record RecallResult(List<HybridResult> results, boolean hybrid) {

    public RecallResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
