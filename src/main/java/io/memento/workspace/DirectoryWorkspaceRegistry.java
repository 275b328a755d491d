package io.memento.workspace;

import io.memento.memory.MemoryStore;
import io.memento.memory.MemoryStoreException;
import io.memento.memory.SQLiteMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One SQLite file per workspace, {@code <dataPath>/<workspace>.db}.
 */
public class DirectoryWorkspaceRegistry implements WorkspaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWorkspaceRegistry.class);
    private static final String SUFFIX = ".db";
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,63}");

    private final Path dataPath;

    public DirectoryWorkspaceRegistry(Path dataPath) {
        this.dataPath = dataPath;
    }

    @Override
    public List<String> listWorkspaces() {
        if (!Files.isDirectory(dataPath)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dataPath)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .filter(name -> VALID_NAME.matcher(name).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list workspaces in {}", dataPath, e);
            return List.of();
        }
    }

    @Override
    public MemoryStore open(String workspace) {
        if (workspace == null || !VALID_NAME.matcher(workspace).matches()) {
            throw new IllegalArgumentException("Invalid workspace name: " + workspace);
        }
        try {
            Files.createDirectories(dataPath);
        } catch (IOException e) {
            throw new MemoryStoreException("Cannot create data directory " + dataPath, e);
        }
        SQLiteMemoryStore store = new SQLiteMemoryStore(dataPath.resolve(workspace + SUFFIX).toString());
        store.init();
        return store;
    }

    public Path getDataPath() {
        return dataPath;
    }
}
