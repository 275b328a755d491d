package io.memento.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A single stored memory in a workspace.
 *
 * <p>Tags are normalized to a lowercase, duplicate-free list in first-seen order. A consolidated
 * memory is terminal: it is never scored, ranked, decayed or used as a consolidation source again.</p>
 *
 * @param id               id, unique within the workspace
 * @param content          text body
 * @param type             open category such as observation, fact or decision
 * @param tags             lowercase tags
 * @param createdAt        creation time, null when unknown
 * @param expiresAt        optional expiry; expired memories are not active
 * @param accessCount      number of retrievals, never negative
 * @param lastAccessedAt   time of the most recent retrieval, or null
 * @param relevance        cached decay score, recomputed by the decay job
 * @param consolidated     whether this memory was merged into another one
 * @param consolidatedInto id of the memory that superseded this one
 * @param linkages         relations to other memories and files
 * @param embeddedAt       when the vector index last stored this memory, or null
 */
public record Memory(
        String id,
        String content,
        String type,
        List<String> tags,
        Instant createdAt,
        Instant expiresAt,
        int accessCount,
        Instant lastAccessedAt,
        double relevance,
        boolean consolidated,
        String consolidatedInto,
        List<Linkage> linkages,
        Instant embeddedAt
) {
    public static final String DEFAULT_TYPE = "observation";
    public static final double DEFAULT_RELEVANCE = 1.0;

    public Memory {
        if (content == null) {
            content = "";
        }
        if (type == null || type.isBlank()) {
            type = DEFAULT_TYPE;
        }
        tags = normalizeTags(tags);
        if (accessCount < 0) {
            accessCount = 0;
        }
        linkages = linkages == null ? List.of() : List.copyOf(linkages);
    }

    /**
     * Creates a fresh, active memory with default counters.
     */
    public static Memory of(String id, String content, String type, Collection<String> tags, Instant createdAt) {
        return new Memory(id, content, type, tags == null ? null : new ArrayList<>(tags), createdAt, null,
                0, null, DEFAULT_RELEVANCE, false, null, List.of(), null);
    }

    public Memory withAccess(int accessCount, Instant lastAccessedAt) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, consolidated, consolidatedInto, linkages, embeddedAt);
    }

    public Memory withRelevance(double relevance) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, consolidated, consolidatedInto, linkages, embeddedAt);
    }

    public Memory withLinkages(List<Linkage> linkages) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, consolidated, consolidatedInto, linkages, embeddedAt);
    }

    public Memory withExpiresAt(Instant expiresAt) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, consolidated, consolidatedInto, linkages, embeddedAt);
    }

    public Memory withEmbeddedAt(Instant embeddedAt) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, consolidated, consolidatedInto, linkages, embeddedAt);
    }

    public Memory consolidatedInto(String targetId) {
        return new Memory(id, content, type, tags, createdAt, expiresAt, accessCount, lastAccessedAt,
                relevance, true, targetId, linkages, embeddedAt);
    }

    /**
     * Active means not consolidated and not expired at {@code now}.
     */
    public boolean isActive(Instant now) {
        if (consolidated) return false;
        return expiresAt == null || now == null || expiresAt.isAfter(now);
    }

    private static List<String> normalizeTags(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag == null) continue;
            String clean = tag.trim().toLowerCase(Locale.ROOT);
            if (!clean.isEmpty()) {
                normalized.add(clean);
            }
        }
        return List.copyOf(normalized);
    }
}
