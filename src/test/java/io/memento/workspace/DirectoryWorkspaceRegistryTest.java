package io.memento.workspace;

import io.memento.memory.Memory;
import io.memento.memory.MemoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryWorkspaceRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListNothingBeforeDirectoryExists() {
        var registry = new DirectoryWorkspaceRegistry(tempDir.resolve("missing"));

        assertTrue(registry.listWorkspaces().isEmpty());
    }

    @Test
    void shouldCreateAndListWorkspaces() throws IOException {
        Path dataPath = tempDir.resolve("workspaces");
        var registry = new DirectoryWorkspaceRegistry(dataPath);

        try (MemoryStore store = registry.open("beta")) {
            store.insert(Memory.of("aaaa0001", "hello", "fact", List.of(), Instant.now()));
        }
        registry.open("alpha").close();
        Files.writeString(dataPath.resolve("notes.txt"), "not a workspace");

        assertEquals(List.of("alpha", "beta"), registry.listWorkspaces());
        try (MemoryStore reopened = registry.open("beta")) {
            assertTrue(reopened.findById("aaaa0001").isPresent());
        }
    }

    @Test
    void shouldRejectInvalidNames() {
        var registry = new DirectoryWorkspaceRegistry(tempDir);

        assertThrows(IllegalArgumentException.class, () -> registry.open("../escape"));
        assertThrows(IllegalArgumentException.class, () -> registry.open(""));
        assertThrows(IllegalArgumentException.class, () -> registry.open(null));
    }
}
