package io.memento.consolidation;

import io.memento.memory.Memory;

import java.util.List;

/**
 * Produces a prose summary for a group of memories being consolidated.
 *
 * <p>Optional: without one, or when it fails or returns blank text, consolidation uses the
 * {@link TemplateSummary}.</p>
 */
@FunctionalInterface
public interface Summarizer {

    /**
     * @param memories the sources, in source order
     * @return summary text; blank means no summary
     */
    String summarize(List<Memory> memories);
}
