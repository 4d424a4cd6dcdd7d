package com.coffeejournal.store.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The modeled collections of a tenant. Each one is persisted as {@code <collectionName>.json}
 * inside the tenant directory.
 */
public enum EntityType {
    PRODUCTS("products", false),
    BATCHES("batches", false),
    BREW_SESSIONS("brew_sessions", false),
    SHOTS("shots", false),
    SHOT_SESSIONS("shot_sessions", false),

    ROASTERS("roasters", true),
    BEAN_TYPES("bean_types", true),
    COUNTRIES("countries", true),
    /** Regions dedup by name within their parent country. */
    REGIONS("regions", true, "country_id"),
    DECAF_METHODS("decaf_methods", true),
    BREW_METHODS("brew_methods", true),
    RECIPES("recipes", true),
    GRINDERS("grinders", true),
    FILTERS("filters", true),
    KETTLES("kettles", true),
    SCALES("scales", true),
    BREWERS("brewers", true),
    PORTAFILTERS("portafilters", true),
    BASKETS("baskets", true),
    TAMPERS("tampers", true),
    WDT_TOOLS("wdt_tools", true),
    LEVELING_TOOLS("leveling_tools", true);

    private final String collectionName;
    private final boolean lookup;
    private final String scopeField;

    EntityType(String collectionName, boolean lookup) {
        this(collectionName, lookup, null);
    }

    EntityType(String collectionName, boolean lookup, String scopeField) {
        this.collectionName = collectionName;
        this.lookup = lookup;
        this.scopeField = scopeField;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public String getFileName() {
        return collectionName + ".json";
    }

    public boolean isLookup() {
        return lookup;
    }

    /** @return the parent reference that scopes name uniqueness, if any */
    public Optional<String> getScopeField() {
        return Optional.ofNullable(scopeField);
    }

    public static Optional<EntityType> fromCollectionName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.collectionName.equals(name))
                .findFirst();
    }
}
