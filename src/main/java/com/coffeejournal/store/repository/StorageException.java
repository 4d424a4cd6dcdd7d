package com.coffeejournal.store.repository;

/**
 * A collection file could not be read, parsed or written.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
