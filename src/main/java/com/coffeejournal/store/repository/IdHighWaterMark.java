package com.coffeejournal.store.repository;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Highest id ever assigned in a collection, kept in a {@code <collection>.meta} file next to
 * it, so deleting the newest record never makes its id available again.
 * Only accessed while the collection lock is held.
 */
@Slf4j
class IdHighWaterMark {

    private static final String LAST_ID = "last_id";

    private final Path file;

    IdHighWaterMark(Path collectionFile) {
        String name = collectionFile.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
        this.file = collectionFile.resolveSibling(base + ".meta");
    }

    Path getFile() {
        return file;
    }

    /** @return the recorded mark, 0 when none was recorded or the file is unreadable */
    long read() {
        try {
            JsonNode root = CollectionCodec.mapper().readTree(Files.readAllBytes(file));
            JsonNode last = root == null ? null : root.get(LAST_ID);
            return last != null && last.canConvertToLong() ? last.asLong() : 0;
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            log.warn("Ignoring unreadable id mark {}: {}", file, e.getMessage());
            return 0;
        }
    }

    void advanceTo(long id) {
        if (id <= read()) {
            return;
        }
        AtomicFiles.write(file, ("{\n  \"" + LAST_ID + "\" : " + id + "\n}").getBytes(StandardCharsets.UTF_8));
    }
}
