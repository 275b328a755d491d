package io.memento.consolidation;

import io.memento.memory.Memory;
import io.memento.memory.Timestamps;

import java.util.List;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Deterministic summary of a group of memories.
 *
 * <pre>
 * [api, auth] — 3 memories consolidated
 *
 * • API moved to /v2 (fact, 2026-01-01 10:00:00) [ab12cd34]
 * • ...
 * </pre>
 *
 * <p>The header lists the sorted tag union; every source contributes one bullet with its id.</p>
 */
public final class TemplateSummary {

    private TemplateSummary() {
    }

    public static String generate(List<Memory> group) {
        TreeSet<String> tags = new TreeSet<>();
        group.forEach(memory -> tags.addAll(memory.tags()));

        StringJoiner bullets = new StringJoiner("\n");
        for (Memory memory : group) {
            String created = memory.createdAt() != null ? Timestamps.format(memory.createdAt()) : "unknown";
            bullets.add("• %s (%s, %s) [%s]".formatted(memory.content(), memory.type(), created, memory.id()));
        }

        String header = "[%s] — %d memories consolidated".formatted(String.join(", ", tags), group.size());
        return header + "\n\n" + bullets;
    }
}
