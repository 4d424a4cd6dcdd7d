package com.coffeejournal.store.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for lookup tables (roasters, grinders, countries...). Adds name-based dedup,
 * a single manually chosen default and a usage-based "smart default".
 */
public interface LookupRepository extends EntityRepository {

    String NAME = "name";
    String SHORT_FORM = "short_form";
    String IS_DEFAULT = "is_default";

    /** Exact match, ignoring case and surrounding whitespace. */
    Optional<EntityRecord> findByName(String name);

    Optional<EntityRecord> findByShortForm(String shortForm);

    /** Tries the name first, then the short form. */
    Optional<EntityRecord> findByNameOrShortForm(String identifier);

    /**
     * Return the record with this name, or create one with the extra fields.
     * Scoped lookups match the name only within the scope value found in {@code extra}.
     */
    EntityRecord getOrCreate(String name, Map<String, ?> extra);

    /** Like {@link #getOrCreate} but also matches on short form. */
    EntityRecord getOrCreateByIdentifier(String identifier, Map<String, ?> extra);

    /** Case-insensitive substring match over name and short form. */
    List<EntityRecord> search(String query);

    Optional<EntityRecord> findDefault();

    /**
     * Mark one record as default and clear the flag on every other one, atomically.
     * @return the new default, or empty if no record has that id
     */
    Optional<EntityRecord> setDefault(long id);

    /** @return the record with its flag cleared, or empty if no record has that id */
    Optional<EntityRecord> clearDefault(long id);

    /** The manual default if one is set, otherwise the best-scoring record by usage. */
    Optional<EntityRecord> getSmartDefault();
}
