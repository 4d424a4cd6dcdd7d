package com.coffeejournal.store.migration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One direct data upgrade between two versions.
 * <p>
 * Implementations must detect data that was already migrated and leave it alone, and must
 * treat missing collection files as nothing to migrate.
 * </p>
 */
public interface Migration {

    String fromVersion();

    String toVersion();

    String description();

    /** Additive migrations that never rewrite existing records may skip the pre-run backup. */
    default boolean requiresBackup() {
        return true;
    }

    void apply(Path dataDir) throws IOException;

    /** @return the edge key, e.g. {@code 1.3->1.4} */
    default String key() {
        return fromVersion() + "->" + toVersion();
    }
}
