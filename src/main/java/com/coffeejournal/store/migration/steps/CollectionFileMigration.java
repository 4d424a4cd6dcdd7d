package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.migration.Migration;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.repository.AtomicFiles;
import com.coffeejournal.store.repository.CollectionCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Base for migrations that rewrite collection files. Reads and writes go through the same
 * codec and atomic-write primitive as the repositories.
 */
abstract class CollectionFileMigration implements Migration {

    /** @return the records of the collection, or empty when its file does not exist */
    protected Optional<List<EntityRecord>> read(Path dataDir, String collectionName) throws IOException {
        Path file = dataDir.resolve(collectionName + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(CollectionCodec.decode(Files.readAllBytes(file)));
    }

    protected void write(Path dataDir, String collectionName, List<EntityRecord> records) {
        AtomicFiles.write(dataDir.resolve(collectionName + ".json"), CollectionCodec.encode(records));
    }

    protected boolean exists(Path dataDir, String collectionName) {
        return Files.exists(dataDir.resolve(collectionName + ".json"));
    }
}
