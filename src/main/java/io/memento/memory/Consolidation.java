package io.memento.memory;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of one merge event. Shares its id with the merged memory it produced.
 *
 * @param id              consolidation id, equal to the merged memory id
 * @param summary         the content given to the merged memory
 * @param sourceIds       merged memory ids, in source order
 * @param tags            sorted tag union
 * @param type            type of the merged memory
 * @param method          how {@code summary} was produced
 * @param templateSummary deterministic template summary, always computed
 * @param createdAt       when the merge happened
 */
public record Consolidation(
        String id,
        String summary,
        List<String> sourceIds,
        List<String> tags,
        String type,
        SummaryMethod method,
        String templateSummary,
        Instant createdAt
) {
    public Consolidation {
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (method == null) {
            method = SummaryMethod.TEMPLATE;
        }
    }
}
