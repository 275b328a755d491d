package io.memento.memory;

/**
 * Raised when a workspace store cannot read or write.
 */
public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message) {
        super(message);
    }

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
