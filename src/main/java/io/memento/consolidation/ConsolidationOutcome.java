package io.memento.consolidation;

import io.memento.memory.Consolidation;
import io.memento.memory.Memory;

import java.util.List;

/**
 * Result of an explicit consolidation request.
 *
 * @param merged         the new memory, null when declined
 * @param consolidation  the audit record, null when declined
 * @param unresolvedIds  requested ids that were missing or already consolidated
 * @param message        reason when declined, null otherwise
 */
public record ConsolidationOutcome(Memory merged, Consolidation consolidation, List<String> unresolvedIds,
                                   String message) {

    public ConsolidationOutcome {
        unresolvedIds = unresolvedIds == null ? List.of() : List.copyOf(unresolvedIds);
    }

    public static ConsolidationOutcome merged(Memory merged, Consolidation consolidation, List<String> unresolvedIds) {
        return new ConsolidationOutcome(merged, consolidation, unresolvedIds, null);
    }

    public static ConsolidationOutcome declined(List<String> unresolvedIds, String message) {
        return new ConsolidationOutcome(null, null, unresolvedIds, message);
    }

    public boolean isMerged() {
        return merged != null;
    }
}
