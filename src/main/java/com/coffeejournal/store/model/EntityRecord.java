package com.coffeejournal.store.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One stored object of a collection: an ordered mapping of field name to value.
 * <p>
 * Every persisted record carries an integer {@code id} plus {@code created_at} and
 * {@code updated_at} timestamps stamped by the storage engine. Values are JSON-shaped:
 * strings, numbers, booleans, null, lists and nested maps. Integral numbers are held as
 * {@code Long} and fractional ones as {@code Double}.
 * </p>
 * Records handed out by a repository are always detached copies; mutating them never
 * changes stored state until they are passed back through {@code update}.
 */
public final class EntityRecord {

    public static final String ID = "id";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private final LinkedHashMap<String, Object> fields;

    private EntityRecord(LinkedHashMap<String, Object> fields) {
        this.fields = fields;
    }

    public static EntityRecord empty() {
        return new EntityRecord(new LinkedHashMap<>());
    }

    /** Build a record from JSON-shaped input; nested values are deep-copied. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EntityRecord of(Map<String, ?> values) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return new EntityRecord(copy);
    }

    /** Convenience for tests and callers building small inputs inline: key, value, key, value... */
    public static EntityRecord of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected an even number of key/value arguments");
        }
        LinkedHashMap<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), copyValue(keyValues[i + 1]));
        }
        return new EntityRecord(map);
    }

    /** @return the record id, or null when the record has not been stored yet */
    public Long getId() {
        return getLong(ID);
    }

    public String getCreatedAt() {
        return getString(CREATED_AT);
    }

    public String getUpdatedAt() {
        return getString(UPDATED_AT);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public Long getLong(String field) {
        Object value = fields.get(field);
        return value instanceof Number n ? n.longValue() : null;
    }

    public boolean isTrue(String field) {
        return Boolean.TRUE.equals(fields.get(field));
    }

    public EntityRecord put(String field, Object value) {
        fields.put(field, copyValue(value));
        return this;
    }

    public Object remove(String field) {
        return fields.remove(field);
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /** Read-only live view, used for serialization and inspection. */
    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    /** Overlay every field of {@code other} on top of this record; incoming values win. */
    public EntityRecord merge(EntityRecord other) {
        other.fields.forEach((k, v) -> fields.put(k, copyValue(v)));
        return this;
    }

    public EntityRecord deepCopy() {
        return of(fields);
    }

    /** True when {@code id} equals the given value, tolerating Integer/Long storage. */
    public boolean hasId(long id) {
        Long own = getId();
        return own != null && own == id;
    }

    /** Compare a stored field value to a probe, treating all integral numbers alike. */
    public boolean fieldEquals(String field, Object probe) {
        Object value = fields.get(field);
        if (value instanceof Number a && probe instanceof Number b) {
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() == b.longValue();
            }
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(value, probe);
    }

    /** True when the field holds {@code probe} directly or inside a list value. */
    public boolean references(String field, long probe) {
        Object value = fields.get(field);
        if (value instanceof Number n) {
            return n.longValue() == probe;
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Number n && n.longValue() == probe) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof java.math.BigInteger;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        if (value instanceof EntityRecord other) {
            return copyValue(other.fields);
        }
        // Same number types as a record read back from disk.
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRecord other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "EntityRecord" + fields;
    }
}
