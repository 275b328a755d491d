package io.memento.memory;

/**
 * How the summary of a consolidation was produced.
 *
 * <ul>
 *   <li>{@code TEMPLATE}: deterministic template built from the sources.</li>
 *   <li>{@code AI}: produced by the summarizer model.</li>
 *   <li>{@code AGENT}: supplied verbatim by the caller of an explicit consolidation.</li>
 * </ul>
 */
public enum SummaryMethod {
    TEMPLATE,
    AI,
    AGENT;

    public String wireName() {
        return name().toLowerCase();
    }

    public static SummaryMethod fromString(String s) {
        if (s == null || s.isBlank()) return TEMPLATE;
        return switch (s.toLowerCase()) {
            case "ai" -> AI;
            case "agent" -> AGENT;
            default -> TEMPLATE;
        };
    }
}
