package com.libragraph.relay.core.storage;

/**
 * Wraps checked I/O exceptions from writing or deleting job-owned files.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
