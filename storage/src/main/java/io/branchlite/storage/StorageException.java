package io.branchlite.storage;

/**
 * Failure reported by an {@link ObjectStore}. Usually wraps an {@link java.io.IOException}.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
