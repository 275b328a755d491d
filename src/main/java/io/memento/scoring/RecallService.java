package io.memento.scoring;

import io.memento.config.MementoProperties;
import io.memento.embedding.Embedder;
import io.memento.embedding.VectorMatch;
import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import io.memento.memory.MemoryStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers a recall query against one workspace.
 *
 * <p>Keyword ranking always runs. When the embedder is available, the query is also matched against
 * the vector index and both sides are fused; the keyword weight comes from the workspace setting
 * {@value #ALPHA_SETTING}, falling back to {@code memento.recall.alpha}. Returned memories have their
 * access recorded.</p>
 */
@Service
public class RecallService {

    private static final Logger log = LoggerFactory.getLogger(RecallService.class);

    static final String ALPHA_SETTING = "recall_alpha";

    private final Embedder embedder;
    private final MementoProperties.Recall settings;

    public RecallService(Embedder embedder, MementoProperties properties) {
        this.embedder = embedder;
        this.settings = properties.recall();
    }

    public RecallResult recall(MemoryStore store, String workspaceId, String query, Instant now) {
        List<ScoredMemory> keyword = RankingAndFusion.scoreAndRankMemories(
                store.findActive(now), query, now, settings.keywordCandidates());

        List<VectorMatch> vector = List.of();
        boolean hybrid = false;
        if (embedder.isAvailable() && query != null && !query.isBlank()) {
            try {
                vector = embedder.search(workspaceId, query, settings.keywordCandidates());
                hybrid = true;
            } catch (RuntimeException e) {
                log.warn("Vector search failed in workspace {}, using keyword results: {}", workspaceId, e.getMessage());
            }
        }

        List<HybridResult> results = hybrid
                ? fuse(store, keyword, vector, resolveAlpha(store))
                : keyword.stream()
                        .limit(settings.limit())
                        .map(s -> new HybridResult(s.memory().id(), s.memory(), s.score(), s.score(), 0))
                        .toList();

        recordAccess(store, workspaceId, results, query, now);
        log.debug("Recall in workspace {} returned {} results (hybrid={})", workspaceId, results.size(), hybrid);
        return new RecallResult(results, hybrid);
    }

    private List<HybridResult> fuse(MemoryStore store, List<ScoredMemory> keyword, List<VectorMatch> vector,
                                    double alpha) {
        List<HybridResult> fused = RankingAndFusion.hybridRank(keyword, vector, alpha, Integer.MAX_VALUE);

        List<String> vectorOnly = fused.stream().filter(HybridResult::isVectorOnly).map(HybridResult::memoryId).toList();
        Map<String, Memory> loaded = vectorOnly.isEmpty() ? Map.of()
                : store.findActiveByIds(vectorOnly).stream()
                        .collect(Collectors.toMap(Memory::id, Function.identity(), (a, b) -> a));

        List<HybridResult> results = new ArrayList<>();
        for (HybridResult result : fused) {
            if (results.size() >= settings.limit()) break;
            if (!result.isVectorOnly()) {
                results.add(result);
            } else if (loaded.containsKey(result.memoryId())) {
                results.add(result.withMemory(loaded.get(result.memoryId())));
            }
            // stale index entries (deleted or consolidated memories) are dropped
        }
        return results;
    }

    double resolveAlpha(MemoryStore store) {
        return store.findSetting(ALPHA_SETTING)
                .flatMap(RecallService::parseAlpha)
                .orElse(settings.alpha());
    }

    private static Optional<Double> parseAlpha(String raw) {
        try {
            double alpha = Double.parseDouble(raw.trim());
            return alpha >= 0 && alpha <= 1 ? Optional.of(alpha) : Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {} setting: {}", ALPHA_SETTING, raw);
            return Optional.empty();
        }
    }

    private void recordAccess(MemoryStore store, String workspaceId, List<HybridResult> results,
                              String query, Instant now) {
        if (results.isEmpty()) return;
        try {
            store.recordAccess(results.stream().map(HybridResult::memoryId).toList(), query, now);
        } catch (MemoryStoreException e) {
            log.warn("Failed to record access in workspace {}", workspaceId, e);
        }
    }
}
