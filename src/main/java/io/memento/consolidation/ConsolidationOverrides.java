package io.memento.consolidation;

import java.util.List;

/**
 * Caller-supplied values for an explicit consolidation.
 *
 * @param content merged content; when blank the summarizer or template is used
 * @param type    merged type; when blank the majority type of the sources is used
 * @param tags    tags added to the union of the source tags
 */
public record ConsolidationOverrides(String content, String type, List<String> tags) {

    public ConsolidationOverrides {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ConsolidationOverrides none() {
        return new ConsolidationOverrides(null, null, List.of());
    }

    boolean hasContent() {
        return content != null && !content.isBlank();
    }

    boolean hasType() {
        return type != null && !type.isBlank();
    }
}
