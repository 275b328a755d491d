package io.memento.memory;

/**
 * A typed relation from a memory to another memory or to a file.
 *
 * @param kind  memory or file
 * @param ref   target memory id, or file path for {@link LinkageKind#FILE}
 * @param label free-form relation label, e.g. {@code consolidated-from}
 */
public record Linkage(LinkageKind kind, String ref, String label) {

    public static final String CONSOLIDATED_FROM = "consolidated-from";

    public Linkage {
        if (kind == null) {
            kind = LinkageKind.MEMORY;
        }
        if (label == null) {
            label = "";
        }
    }

    public static Linkage toMemory(String memoryId, String label) {
        return new Linkage(LinkageKind.MEMORY, memoryId, label);
    }

    public static Linkage toFile(String path, String label) {
        return new Linkage(LinkageKind.FILE, path, label);
    }

    public static Linkage consolidatedFrom(String sourceId) {
        return toMemory(sourceId, CONSOLIDATED_FROM);
    }

    public boolean isConsolidatedFrom() {
        return kind == LinkageKind.MEMORY && CONSOLIDATED_FROM.equals(label);
    }
}
