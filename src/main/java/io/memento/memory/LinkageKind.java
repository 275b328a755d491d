package io.memento.memory;

/**
 * What a {@link Linkage} points at.
 *
 * <ul>
 *   <li>{@code MEMORY}: another memory in the same workspace, referenced by id.</li>
 *   <li>{@code FILE}: a file, referenced by path.</li>
 * </ul>
 */
public enum LinkageKind {
    MEMORY("memory"),
    FILE("file");

    private final String wireName;

    LinkageKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the value stored in the {@code type} field of the linkage JSON.
     */
    public String wireName() {
        return wireName;
    }

    public static LinkageKind fromString(String s) {
        if (s == null || s.isBlank()) return MEMORY;
        return switch (s.toLowerCase()) {
            case "file" -> FILE;
            default -> MEMORY;
        };
    }
}
