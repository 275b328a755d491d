package io.memento.scoring;

import io.memento.memory.Memory;

/**
 * One entry of a fused keyword + vector ranking.
 *
 * @param memoryId     memory id
 * @param memory       the memory, or null for a vector-only hit that the caller must load
 * @param score        {@code alpha * keywordScore + (1 - alpha) * vectorScore}
 * @param keywordScore normalized keyword score (0-1), 0 for vector-only hits
 * @param vectorScore  normalized vector score (0-1), 0 for keyword-only hits
 */
public record HybridResult(
        String memoryId,
        Memory memory,
        double score,
        double keywordScore,
        double vectorScore
) {
    public boolean isVectorOnly() {
        return memory == null;
    }

    public HybridResult withMemory(Memory resolved) {
        return new HybridResult(memoryId, resolved, score, keywordScore, vectorScore);
    }
}
