package com.coffeejournal.store.repository;

import com.coffeejournal.store.model.EntityRecord;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Last parsed content of one collection file, tagged with the stamp the file had when it
 * was read or written. Callers always receive deep copies.
 */
class CollectionCache {

    private final Object monitor = new Object();
    private List<EntityRecord> records;
    private FileStamp stamp;

    Optional<List<EntityRecord>> get(FileStamp current) {
        synchronized (monitor) {
            if (records == null || stamp == null || !stamp.equals(current)) {
                return Optional.empty();
            }
            return Optional.of(copy(records));
        }
    }

    void put(List<EntityRecord> content, FileStamp current) {
        synchronized (monitor) {
            this.records = copy(content);
            this.stamp = current;
        }
    }

    void invalidate() {
        synchronized (monitor) {
            this.records = null;
            this.stamp = null;
        }
    }

    private static List<EntityRecord> copy(List<EntityRecord> source) {
        return source.stream().map(EntityRecord::deepCopy).collect(Collectors.toList());
    }
}
