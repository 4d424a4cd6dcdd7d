package com.coffeejournal.store.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository abstraction over one collection of one tenant.
 * <p>
 * Implementations should honor these constraints:
 * - Reads never observe a partially written collection.
 * - Returned records are copies; callers cannot mutate stored state through them.
 * - A missing id is reported as an empty result, never as an exception.
 * </p>
 */
public interface EntityRepository {

    /** @return the collection name this repository persists, e.g. {@code products} */
    String getCollectionName();

    /**
     * Store a new record. Unknown fields are stripped, an id is assigned and both
     * timestamps are stamped before validation.
     * @param input caller-supplied fields; {@code id} and timestamps are ignored
     * @return the stored record
     */
    EntityRecord create(Map<String, ?> input);

    /**
     * Merge the given fields over an existing record. The id and {@code created_at}
     * are preserved and {@code updated_at} is restamped.
     * @return the updated record, or empty if no record has the given id
     */
    Optional<EntityRecord> update(long id, Map<String, ?> input);

    /** @return true if a record was removed */
    boolean delete(long id);

    Optional<EntityRecord> findById(long id);

    List<EntityRecord> findAll();

    /** Full-scan filter on one field; integral numbers compare by value. */
    List<EntityRecord> findByField(String field, Object value);

    /**
     * Remove every record whose field equals the value, in a single write.
     * @return number of records removed
     */
    int deleteByField(String field, Object value);

    /**
     * Set the given reference field to null on every record that points at {@code id},
     * in a single write. Used to detach children before deleting a parent.
     * @return number of records changed
     */
    int clearReferences(String field, long id);

    /** Drop any cached state so the next read goes to disk. */
    void invalidate();
}
