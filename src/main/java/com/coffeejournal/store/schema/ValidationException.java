package com.coffeejournal.store.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A record violated its collection schema. Raised before anything touches disk.
 * Names every offending field so the caller can report them all at once.
 */
public class ValidationException extends RuntimeException {

    private final String collectionName;
    private final Map<String, String> fieldErrors;

    public ValidationException(String collectionName, Map<String, String> fieldErrors) {
        super("Schema validation failed for " + collectionName + ": " + describe(fieldErrors));
        this.collectionName = collectionName;
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public String getCollectionName() {
        return collectionName;
    }

    /** @return offending field name mapped to what is wrong with it */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    private static String describe(Map<String, String> errors) {
        return errors.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
