package com.coffeejournal.store.schema;

import com.coffeejournal.store.model.EntityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.coffeejournal.store.schema.FieldType.ARRAY;
import static com.coffeejournal.store.schema.FieldType.BOOLEAN;
import static com.coffeejournal.store.schema.FieldType.INTEGER;
import static com.coffeejournal.store.schema.FieldType.NUMBER;
import static com.coffeejournal.store.schema.FieldType.STRING;

/**
 * Closed schemas for every modeled collection.
 * <p>
 * Collections without a schema are stored as-is: nothing is stripped and nothing is
 * validated. Modeled collections always go through strip-then-validate, which keeps
 * derived view data (embedded copies of related objects, display names) out of storage.
 * </p>
 */
@Slf4j
@Component
public class SchemaRegistry {

    public static final String[] BEAN_PROCESSES = {
            "Washed (wet)", "Natural (dry)", "Honey", "Semi-washed (wet-hulled)",
            "Anaerobic", "Carbonic Maceration", "Other"
    };

    private final Map<String, EntitySchema> schemas;

    public SchemaRegistry() {
        Map<String, EntitySchema> all = new HashMap<>();
        define(all);
        this.schemas = Collections.unmodifiableMap(all);
    }

    public Optional<EntitySchema> getSchema(String collectionName) {
        return Optional.ofNullable(schemas.get(normalize(collectionName)));
    }

    public Set<String> getModeledCollections() {
        return schemas.keySet();
    }

    /** @return a copy with every undeclared field removed; unmodeled collections are returned unchanged */
    public EntityRecord stripUnknownFields(String collectionName, EntityRecord record) {
        Optional<EntitySchema> schema = getSchema(collectionName);
        if (schema.isEmpty()) {
            return record.deepCopy();
        }
        EntityRecord stripped = schema.get().strip(record);
        if (log.isDebugEnabled() && stripped.fieldNames().size() != record.fieldNames().size()) {
            Set<String> dropped = new LinkedHashSet<>(record.fieldNames());
            dropped.removeAll(stripped.fieldNames());
            log.debug("Stripped undeclared fields {} from {} record", dropped, collectionName);
        }
        return stripped;
    }

    /**
     * @throws ValidationException naming every offending field
     */
    public void validate(String collectionName, EntityRecord record) {
        Optional<EntitySchema> schema = getSchema(collectionName);
        if (schema.isEmpty()) {
            return;
        }
        Map<String, String> errors = schema.get().check(record);
        if (!errors.isEmpty()) {
            throw new ValidationException(normalize(collectionName), errors);
        }
    }

    private static String normalize(String collectionName) {
        return collectionName.endsWith(".json")
                ? collectionName.substring(0, collectionName.length() - 5)
                : collectionName;
    }

    // ---- schema definitions ----

    private static FieldRule id() {
        return FieldRule.of(INTEGER).min(1);
    }

    private static FieldRule timestamp() {
        return FieldRule.of(STRING).dateTime();
    }

    private static FieldRule text() {
        return FieldRule.of(STRING).nullable();
    }

    private static FieldRule reference() {
        return FieldRule.of(INTEGER).nullable();
    }

    private static FieldRule amount() {
        return FieldRule.of(NUMBER).nullable().min(0);
    }

    private static FieldRule tasteNote() {
        return FieldRule.of(INTEGER).nullable().range(1, 10);
    }

    private static FieldRule halfStarRating() {
        return FieldRule.of(NUMBER).nullable().range(0, 5).multipleOf(0.5);
    }

    private static FieldRule score() {
        return FieldRule.of(NUMBER).nullable().range(1.0, 10.0);
    }

    private static FieldRule isoDate() {
        return FieldRule.of(STRING).pattern("^\\d{4}-\\d{2}-\\d{2}$");
    }

    private static EntitySchema.Builder audited(String name) {
        return EntitySchema.builder(name)
                .field("id", id())
                .field("created_at", timestamp())
                .field("updated_at", timestamp());
    }

    private static void define(Map<String, EntitySchema> all) {
        EntitySchema lookup = audited("lookup")
                .required("name")
                .field("name", FieldRule.of(STRING).minLength(1))
                .field("short_form", text())
                .field("description", text())
                .field("notes", text())
                .field("url", text())
                .field("image_url", text())
                .field("icon", text())
                .field("is_default", FieldRule.of(BOOLEAN))
                .build();

        register(all, audited("products")
                .required("product_name")
                .field("roaster_id", reference())
                .field("bean_type_id", FieldRule.of(ARRAY).items(INTEGER))
                .field("country_id", reference())
                .field("region_id", FieldRule.of(ARRAY).items(INTEGER))
                .field("product_name", FieldRule.of(STRING).minLength(1))
                .field("roast_type", FieldRule.of(INTEGER).nullable().range(1, 10))
                .field("description", text())
                .field("url", text())
                .field("image_url", text())
                .field("decaf", FieldRule.of(BOOLEAN))
                .field("decaf_method_id", reference())
                .field("rating", halfStarRating())
                .field("bean_process", FieldRule.of(ARRAY).nullable().items(STRING)
                        .itemsOneOf((Object[]) BEAN_PROCESSES).uniqueItems())
                .field("notes", text()));

        register(all, audited("batches")
                .required("product_id", "roast_date")
                .field("product_id", FieldRule.of(INTEGER))
                .field("roast_date", isoDate())
                .field("purchase_date", isoDate().nullable())
                .field("amount_grams", amount())
                .field("price", amount())
                .field("seller", text())
                .field("notes", text())
                .field("rating", halfStarRating())
                .field("is_active", FieldRule.of(BOOLEAN)));

        register(all, audited("brew_sessions")
                .field("timestamp", FieldRule.of(STRING))
                .field("product_batch_id", reference())
                .field("product_id", reference())
                .field("brew_method_id", reference())
                .field("brewer_id", reference())
                .field("recipe_id", reference())
                .field("grinder_id", reference())
                .field("filter_id", reference())
                .field("kettle_id", reference())
                .field("scale_id", reference())
                .field("amount_coffee_grams", amount())
                .field("amount_water_grams", amount())
                .field("brew_temperature_c", FieldRule.of(NUMBER).nullable())
                .field("bloom_time_seconds", amount())
                .field("brew_time_seconds", amount())
                .field("sweetness", tasteNote())
                .field("acidity", tasteNote())
                .field("bitterness", tasteNote())
                .field("body", tasteNote())
                .field("aroma", tasteNote())
                .field("flavor_profile_match", tasteNote())
                .field("notes", text())
                .field("score", score())
                .field("grinder_setting", FieldRule.of(STRING, NUMBER).nullable()));

        register(all, audited("shots")
                .required("dose_grams", "yield_grams")
                .field("timestamp", FieldRule.of(STRING))
                .field("product_batch_id", reference())
                .field("product_id", reference())
                .field("shot_session_id", reference())
                .field("brewer_id", reference())
                .field("grinder_id", reference())
                .field("portafilter_id", reference())
                .field("basket_id", reference())
                .field("tamper_id", reference())
                .field("wdt_tool_id", reference())
                .field("leveling_tool_id", reference())
                .field("scale_id", reference())
                .field("recipe_id", reference())
                .field("dose_grams", FieldRule.of(NUMBER).min(0))
                .field("yield_grams", FieldRule.of(NUMBER).min(0))
                .field("preinfusion_seconds", amount())
                .field("extraction_time_seconds", amount())
                .field("brew_time_seconds", amount())
                .field("pressure_bars", amount())
                .field("water_temperature_c", FieldRule.of(NUMBER).nullable())
                .field("temperature_c", FieldRule.of(NUMBER).nullable())
                .field("grinder_setting", FieldRule.of(STRING, NUMBER).nullable())
                .field("sweetness", tasteNote())
                .field("acidity", tasteNote())
                .field("bitterness", tasteNote())
                .field("body", tasteNote())
                .field("aroma", tasteNote())
                .field("crema", tasteNote())
                .field("flavor_profile_match", tasteNote())
                .field("extraction_status", text()
                        .oneOf("channeling", "over-extracted", "under-extracted", "perfect", "balanced"))
                .field("notes", text())
                .field("score", score())
                .field("overall_score", FieldRule.of(NUMBER).nullable().range(0, 10))
                .field("ratio", text()));

        register(all, audited("shot_sessions")
                .required("title")
                .field("title", FieldRule.of(STRING).minLength(1))
                .field("product_id", reference())
                .field("product_batch_id", reference())
                .field("brewer_id", reference())
                .field("notes", text()));

        for (String plain : new String[]{"roasters", "bean_types", "countries", "decaf_methods",
                "scales", "leveling_tools"}) {
            register(all, EntitySchema.builder(plain).extend(lookup));
        }

        register(all, EntitySchema.builder("brew_methods").extend(lookup)
                .field("brew_time_range", text())
                .field("water_temperature", text())
                .field("grind_size", text()));

        register(all, EntitySchema.builder("recipes").extend(lookup)
                .field("coffee_ratio", text())
                .field("instructions", text())
                .field("brew_method", text()));

        register(all, EntitySchema.builder("grinders").extend(lookup)
                .field("brand", text())
                .field("grinder_type", text())
                .field("burr_material", text())
                .field("product_url", text())
                .field("manually_ground_grams", amount()));

        register(all, EntitySchema.builder("filters").extend(lookup)
                .field("material", text())
                .field("brand", text())
                .field("compatibility", text()));

        register(all, EntitySchema.builder("kettles").extend(lookup)
                .field("brand", text())
                .field("capacity", text())
                .field("kettle_type", text())
                .field("product_url", text()));

        register(all, EntitySchema.builder("brewers").extend(lookup)
                .field("type", text())
                .field("brand", text())
                .field("model", text()));

        register(all, EntitySchema.builder("portafilters").extend(lookup)
                .field("size", text())
                .field("size_mm", reference())
                .field("bottomless", FieldRule.of(BOOLEAN).nullable())
                .field("brand", text())
                .field("material", text())
                .field("handle_type", text()));

        register(all, EntitySchema.builder("baskets").extend(lookup)
                .field("basket_type", text())
                .field("hole_count", reference())
                .field("capacity_grams", FieldRule.of(NUMBER).nullable())
                .field("pressurized", FieldRule.of(BOOLEAN).nullable())
                .field("size", text())
                .field("brand", text())
                .field("material", text())
                .field("holes", reference()));

        register(all, EntitySchema.builder("tampers").extend(lookup)
                .field("size", text())
                .field("weight", FieldRule.of(NUMBER).nullable())
                .field("handle_material", text())
                .field("base_material", text())
                .field("brand", text()));

        register(all, EntitySchema.builder("wdt_tools").extend(lookup)
                .field("needle_count", reference())
                .field("needle_diameter", FieldRule.of(STRING, NUMBER).nullable())
                .field("brand", text())
                .field("handle_material", text()));

        register(all, EntitySchema.builder("regions").extend(lookup)
                .required("country_id")
                .field("country_id", FieldRule.of(INTEGER)));
    }

    private static void register(Map<String, EntitySchema> all, EntitySchema.Builder builder) {
        EntitySchema schema = builder.build();
        all.put(schema.getCollectionName(), schema);
    }
}
