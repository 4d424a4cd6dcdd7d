package com.coffeejournal.store.migration;

/**
 * A migration run was aborted. The data version marker still holds its previous value.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
