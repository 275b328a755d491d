package io.memento.consolidation;

import io.memento.config.MementoProperties;
import io.memento.embedding.Embedder;
import io.memento.memory.Consolidation;
import io.memento.memory.Linkage;
import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import io.memento.memory.MemoryStoreException;
import io.memento.memory.SummaryMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Merges groups of related memories into one new memory.
 *
 * <p>Two entry points: {@link #consolidateCluster} groups a workspace's active memories by shared tags,
 * {@link #consolidateExplicit} merges ids chosen by the caller. Each merge is written through
 * {@link MemoryStore#applyConsolidation}, so the sources are flipped together with the insert or not at all.
 * Embedding the merged memory runs afterwards on a separate executor; its failure never fails the merge.</p>
 */
@Service
public class ConsolidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationEngine.class);

    private final Summarizer summarizer;
    private final Embedder embedder;
    private final Executor embeddingExecutor;
    private final MementoProperties.Consolidation settings;
    private final Supplier<String> idGenerator;

    @Autowired
    public ConsolidationEngine(
            @Nullable Summarizer summarizer,
            Embedder embedder,
            @Qualifier("embeddingExecutor") Executor embeddingExecutor,
            MementoProperties properties) {
        this(summarizer, embedder, embeddingExecutor, properties, ConsolidationEngine::newId);
    }

    ConsolidationEngine(Summarizer summarizer, Embedder embedder, Executor embeddingExecutor,
                        MementoProperties properties, Supplier<String> idGenerator) {
        this.summarizer = summarizer;
        this.embedder = embedder;
        this.embeddingExecutor = embeddingExecutor;
        this.settings = properties.consolidation();
        this.idGenerator = idGenerator;
    }

    /**
     * Finds tag clusters among the active memories and merges each one that is large enough.
     * A group whose merge fails is counted and skipped; the others still run.
     */
    public AutoConsolidationResult consolidateCluster(MemoryStore store, String workspaceId, Instant now) {
        List<List<Memory>> groups = TagClusterer.findGroups(store.findActive(now), settings.minGroupSize());
        if (groups.isEmpty()) {
            log.debug("No tag clusters to consolidate in workspace {}", workspaceId);
            return AutoConsolidationResult.none();
        }

        List<String> mergedIds = new ArrayList<>();
        int sourceCount = 0;
        int failed = 0;
        for (List<Memory> group : groups) {
            String id = idGenerator.get();
            Summary summary = summarize(group);
            String type = majorityType(group);
            Memory merged = merge(id, group, summary.text(), type, List.of(), now);
            Consolidation record = new Consolidation(id, summary.text(), ids(group), merged.tags(), type,
                    summary.method(), summary.template(), now);
            try {
                store.applyConsolidation(merged, record, ids(group));
            } catch (MemoryStoreException e) {
                log.error("Failed to consolidate group of {} in workspace {}", group.size(), workspaceId, e);
                failed++;
                continue;
            }
            mergedIds.add(id);
            sourceCount += group.size();
            scheduleEmbedding(workspaceId, merged);
        }

        log.info("Consolidated {} groups ({} memories) in workspace {}, {} failed",
                mergedIds.size(), sourceCount, workspaceId, failed);
        return new AutoConsolidationResult(mergedIds.size(), sourceCount, mergedIds, failed);
    }

    /**
     * Merges the given memories. Ids that are unknown or already consolidated are ignored and reported;
     * when fewer than two remain, nothing is written and the outcome is declined.
     *
     * @throws MemoryStoreException if the merge could not be committed
     */
    public ConsolidationOutcome consolidateExplicit(MemoryStore store, String workspaceId, List<String> ids,
                                                    ConsolidationOverrides overrides, Instant now) {
        ConsolidationOverrides effective = overrides != null ? overrides : ConsolidationOverrides.none();
        List<String> requested = ids == null ? List.of()
                : ids.stream().filter(Objects::nonNull).distinct().toList();

        Map<String, Memory> active = store.findActiveByIds(requested).stream()
                .collect(Collectors.toMap(Memory::id, Function.identity(), (a, b) -> a));
        List<Memory> sources = requested.stream().filter(active::containsKey).map(active::get).toList();
        List<String> unresolved = requested.stream().filter(id -> !active.containsKey(id)).toList();

        if (sources.size() < 2) {
            String message = requested.size() < 2
                    ? "At least 2 memory ids are required"
                    : "Fewer than 2 of the requested memories are active: " + unresolved;
            log.info("Declined consolidation in workspace {}: {}", workspaceId, message);
            return ConsolidationOutcome.declined(unresolved, message);
        }

        String id = idGenerator.get();
        Summary summary = effective.hasContent()
                ? new Summary(effective.content().trim(), SummaryMethod.AGENT, TemplateSummary.generate(sources))
                : summarize(sources);
        String type = effective.hasType() ? effective.type().trim() : majorityType(sources);
        Memory merged = merge(id, sources, summary.text(), type, effective.tags(), now);
        Consolidation record = new Consolidation(id, summary.text(), ids(sources), merged.tags(), type,
                summary.method(), summary.template(), now);

        store.applyConsolidation(merged, record, ids(sources));
        log.info("Consolidated {} memories into {} in workspace {} ({})",
                sources.size(), id, workspaceId, summary.method().wireName());
        scheduleEmbedding(workspaceId, merged);
        return ConsolidationOutcome.merged(merged, record, unresolved);
    }

    static Memory merge(String id, List<Memory> sources, String content, String type,
                        Collection<String> extraTags, Instant now) {
        TreeSet<String> tags = new TreeSet<>();
        sources.forEach(source -> tags.addAll(source.tags()));
        for (String tag : extraTags) {
            if (tag != null && !tag.isBlank()) {
                tags.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }

        long accessCount = 0;
        for (Memory source : sources) {
            accessCount += source.accessCount();
        }

        LinkedHashSet<Linkage> linkages = new LinkedHashSet<>();
        sources.forEach(source -> linkages.add(Linkage.consolidatedFrom(source.id())));
        sources.forEach(source -> linkages.addAll(source.linkages()));

        return new Memory(id, content, type, new ArrayList<>(tags), now, null,
                (int) Math.min(Integer.MAX_VALUE, accessCount), null, Memory.DEFAULT_RELEVANCE,
                false, null, new ArrayList<>(linkages), null);
    }

    /**
     * Most frequent type among the sources; on a tie the type seen first in source order wins.
     */
    static String majorityType(List<Memory> sources) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        sources.forEach(source -> counts.merge(source.type(), 1, Integer::sum));
        String best = null;
        int bestCount = 0;
        for (var entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > bestCount) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best != null ? best : Memory.DEFAULT_TYPE;
    }

    private Summary summarize(List<Memory> group) {
        String template = TemplateSummary.generate(group);
        if (summarizer != null && settings.aiSummaryEnabled()) {
            try {
                String text = summarizer.summarize(group);
                if (text != null && !text.isBlank()) {
                    return new Summary(text.trim(), SummaryMethod.AI, template);
                }
                log.warn("Summarizer returned no text, using template summary");
            } catch (RuntimeException e) {
                log.warn("Summarizer failed, using template summary: {}", e.getMessage());
            }
        }
        return new Summary(template, SummaryMethod.TEMPLATE, template);
    }

    private void scheduleEmbedding(String workspaceId, Memory merged) {
        if (!embedder.isAvailable()) return;
        try {
            embeddingExecutor.execute(() -> {
                try {
                    boolean stored = embedder.embedAndStore(workspaceId, merged.id(), merged.content());
                    log.debug("Embedding of consolidated memory {}: {}", merged.id(), stored ? "stored" : "skipped");
                } catch (RuntimeException e) {
                    log.warn("Failed to embed consolidated memory {} in workspace {}", merged.id(), workspaceId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Embedding executor rejected consolidated memory {}", merged.id(), e);
        }
    }

    private static List<String> ids(List<Memory> memories) {
        return memories.stream().map(Memory::id).toList();
    }

    private static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private record Summary(String text, SummaryMethod method, String template) {
    }
}
