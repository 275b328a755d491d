package io.memento.scoring;

import io.memento.embedding.VectorMatch;
import io.memento.memory.Memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks memory collections by keyword score and fuses keyword results with vector-similarity hits.
 *
 * <p>Pure functions over in-memory collections; safe to call concurrently.</p>
 */
public final class RankingAndFusion {

    public static final double DEFAULT_ALPHA = 0.5;
    public static final int DEFAULT_LIMIT = 10;

    private static final Comparator<ScoredMemory> KEYWORD_ORDER = Comparator
            .comparingDouble(ScoredMemory::score)
            .reversed()
            .thenComparing((ScoredMemory scored) -> scored.memory().createdAt(),
                    Comparator.nullsLast(Comparator.reverseOrder()));

    private static final Comparator<HybridResult> HYBRID_ORDER = Comparator
            .comparingDouble(HybridResult::score)
            .reversed()
            .thenComparing(Comparator.comparingDouble(HybridResult::vectorScore).reversed());

    private RankingAndFusion() {
    }

    /**
     * Splits a raw query into lowercase whitespace-separated terms.
     */
    public static List<String> tokenize(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("(?U)\\s+"))
                .filter(term -> !term.isEmpty())
                .toList();
    }

    /**
     * Scores every memory against the query, drops zero scores, and returns the top {@code limit}
     * by score descending, newest first on ties. Consolidated memories are never ranked.
     *
     * @param memories candidate memories of one workspace
     * @param query    raw query text
     * @param now      reference time
     * @param limit    maximum number of results
     * @return ranked results
     */
    public static List<ScoredMemory> scoreAndRankMemories(Collection<Memory> memories, String query,
                                                          Instant now, int limit) {
        List<String> terms = tokenize(query);
        List<ScoredMemory> scored = new ArrayList<>();
        for (Memory memory : memories) {
            if (memory.consolidated()) continue;
            double score = ScoringEngine.scoreMemory(memory, terms, now);
            if (score > 0) {
                scored.add(new ScoredMemory(memory, score));
            }
        }
        scored.sort(KEYWORD_ORDER);
        return List.copyOf(scored.subList(0, Math.min(Math.max(limit, 0), scored.size())));
    }

    public static List<HybridResult> hybridRank(List<ScoredMemory> keywordResults, List<VectorMatch> vectorResults) {
        return hybridRank(keywordResults, vectorResults, DEFAULT_ALPHA, DEFAULT_LIMIT);
    }

    /**
     * Fuses keyword and vector results.
     *
     * <p>Each side is normalized by its own maximum, entries are merged by memory id, and the final
     * score is {@code alpha * keyword + (1 - alpha) * vector}. Ties go to the higher vector score.
     * Vector-only entries carry a null memory.</p>
     *
     * @param keywordResults output of {@link #scoreAndRankMemories}
     * @param vectorResults  hits from the vector index
     * @param alpha          weight of the keyword side, 0-1
     * @param limit          maximum number of results
     * @return fused ranking without duplicate ids
     */
    public static List<HybridResult> hybridRank(List<ScoredMemory> keywordResults, List<VectorMatch> vectorResults,
                                                double alpha, int limit) {
        double maxKeyword = keywordResults.stream().mapToDouble(ScoredMemory::score).max().orElse(0);
        double maxVector = vectorResults.stream().mapToDouble(VectorMatch::score).max().orElse(0);

        Map<String, Entry> merged = new LinkedHashMap<>();
        for (ScoredMemory result : keywordResults) {
            Entry entry = merged.computeIfAbsent(result.memory().id(), Entry::new);
            entry.memory = result.memory();
            entry.keywordScore = Math.max(entry.keywordScore, normalize(result.score(), maxKeyword));
        }
        for (VectorMatch match : vectorResults) {
            Entry entry = merged.computeIfAbsent(match.id(), Entry::new);
            entry.vectorScore = Math.max(entry.vectorScore, normalize(match.score(), maxVector));
        }

        List<HybridResult> results = new ArrayList<>(merged.size());
        for (Entry entry : merged.values()) {
            double score = alpha * entry.keywordScore + (1 - alpha) * entry.vectorScore;
            results.add(new HybridResult(entry.memoryId, entry.memory, score, entry.keywordScore, entry.vectorScore));
        }
        results.sort(HYBRID_ORDER);
        return List.copyOf(results.subList(0, Math.min(Math.max(limit, 0), results.size())));
    }

    private static double normalize(double score, double max) {
        return max > 0 ? score / max : 0;
    }

    private static final class Entry {
        private final String memoryId;
        private Memory memory;
        private double keywordScore;
        private double vectorScore;

        private Entry(String memoryId) {
            this.memoryId = memoryId;
        }
    }
}
