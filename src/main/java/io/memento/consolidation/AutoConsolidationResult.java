package io.memento.consolidation;

import java.util.List;

/**
 * Summary of one clustering pass over a workspace.
 *
 * @param groups           groups merged
 * @param sourceCount      memories consolidated across all merged groups
 * @param mergedIds        ids of the new memories
 * @param failedGroups     groups whose merge could not be committed
 */
public record AutoConsolidationResult(int groups, int sourceCount, List<String> mergedIds, int failedGroups) {

    public AutoConsolidationResult {
        mergedIds = mergedIds == null ? List.of() : List.copyOf(mergedIds);
    }

    public static AutoConsolidationResult none() {
        return new AutoConsolidationResult(0, 0, List.of(), 0);
    }
}
