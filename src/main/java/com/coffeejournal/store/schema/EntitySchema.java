package com.coffeejournal.store.schema;

import com.coffeejournal.store.model.EntityRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closed schema of one collection: every allowed field has a rule, and no other field
 * may be persisted.
 */
public final class EntitySchema {

    private final String collectionName;
    private final Map<String, FieldRule> rules;
    private final Set<String> required;

    private EntitySchema(String collectionName, Map<String, FieldRule> rules, Set<String> required) {
        this.collectionName = collectionName;
        this.rules = Collections.unmodifiableMap(rules);
        this.required = Collections.unmodifiableSet(required);
    }

    public static Builder builder(String collectionName) {
        return new Builder(collectionName);
    }

    public String getCollectionName() {
        return collectionName;
    }

    public Set<String> getAllowedFields() {
        return rules.keySet();
    }

    public Set<String> getRequiredFields() {
        return required;
    }

    public FieldRule getRule(String field) {
        return rules.get(field);
    }

    /** @return a copy holding only allowed fields, in their original order */
    public EntityRecord strip(EntityRecord record) {
        EntityRecord stripped = EntityRecord.empty();
        for (String field : record.fieldNames()) {
            if (rules.containsKey(field)) {
                stripped.put(field, record.get(field));
            }
        }
        return stripped;
    }

    /** @return offending field name mapped to its problems; empty when the record is valid */
    public Map<String, String> check(EntityRecord record) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (String field : required) {
            if (!record.has(field)) {
                errors.put(field, "is required");
            }
        }
        for (String field : record.fieldNames()) {
            FieldRule rule = rules.get(field);
            if (rule == null) {
                errors.put(field, "is not an allowed field");
                continue;
            }
            List<String> problems = rule.check(record.get(field));
            if (!problems.isEmpty()) {
                errors.put(field, String.join("; ", problems));
            }
        }
        return errors;
    }

    public static final class Builder {
        private final String collectionName;
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();
        private final Set<String> required = new LinkedHashSet<>();

        private Builder(String collectionName) {
            this.collectionName = collectionName;
        }

        public Builder field(String name, FieldRule rule) {
            rules.put(name, rule);
            return this;
        }

        public Builder required(String... names) {
            required.addAll(List.of(names));
            return this;
        }

        /** Start from another schema's fields and required set. */
        public Builder extend(EntitySchema base) {
            rules.putAll(base.rules);
            required.addAll(base.required);
            return this;
        }

        public EntitySchema build() {
            return new EntitySchema(collectionName, new LinkedHashMap<>(rules), new LinkedHashSet<>(required));
        }
    }
}
