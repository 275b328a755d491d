package io.memento.workspace;

import io.memento.memory.MemoryStore;

import java.util.List;

/**
 * Enumerates workspaces and opens their stores.
 */
public interface WorkspaceRegistry {

    /**
     * Names of all known workspaces, sorted.
     */
    List<String> listWorkspaces();

    /**
     * Opens the store of one workspace. The caller owns the returned store and must close it.
     *
     * @throws IllegalArgumentException if the name is not a valid workspace name
     * @throws io.memento.memory.MemoryStoreException if the store cannot be opened
     */
    MemoryStore open(String workspace);
}
