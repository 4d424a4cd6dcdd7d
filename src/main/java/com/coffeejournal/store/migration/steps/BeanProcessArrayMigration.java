package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.model.EntityRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * 1.5 to 1.6: {@code products.bean_process} turns from free text into an array of
 * standard processing methods. Values that are already arrays are left alone.
 */
@Slf4j
public class BeanProcessArrayMigration extends CollectionFileMigration {

    private static final String WASHED = "Washed (wet)";
    private static final String NATURAL = "Natural (dry)";
    private static final String OTHER = "Other";

    static final Map<String, List<String>> KNOWN_VALUES = Map.ofEntries(
            entry("Washed", List.of(WASHED)),
            entry("Vasket", List.of(WASHED)),
            entry("Natural", List.of(NATURAL)),
            entry("Natural/Anaerobic", List.of(NATURAL, "Anaerobic")),
            entry("Honey", List.of("Honey")),
            entry("Washed, Natural", List.of(WASHED, NATURAL)),
            entry("Dried", List.of(NATURAL)),
            entry("Dried whole beans", List.of(NATURAL)),
            entry("Sun dried", List.of(NATURAL)),
            entry("Dried with and without fruit", List.of(OTHER)));

    @Override
    public String fromVersion() {
        return "1.5";
    }

    @Override
    public String toVersion() {
        return "1.6";
    }

    @Override
    public String description() {
        return "Convert bean_process from text to an array of standard processing methods";
    }

    @Override
    public void apply(Path dataDir) throws IOException {
        Optional<List<EntityRecord>> loaded = read(dataDir, "products");
        if (loaded.isEmpty()) {
            log.info("No products in {}, skipping bean process conversion", dataDir);
            return;
        }
        List<EntityRecord> products = loaded.get();
        int converted = 0;
        for (EntityRecord product : products) {
            if (!product.has("bean_process") || product.get("bean_process") instanceof List<?>) {
                continue;
            }
            Object old = product.get("bean_process");
            List<String> mapped = toArray(old);
            if (mapped.equals(List.of(OTHER)) && !KNOWN_VALUES.containsKey(String.valueOf(old))) {
                log.warn("Unknown bean_process '{}' on product {}, mapped to {}", old, product.getId(), mapped);
            }
            product.put("bean_process", mapped);
            converted++;
        }
        if (converted > 0) {
            write(dataDir, "products", products);
        }
        log.info("Converted bean_process on {} products in {}", converted, dataDir);
    }

    static List<String> toArray(Object value) {
        if (value == null) {
            return List.of();
        }
        String text = value.toString();
        List<String> known = KNOWN_VALUES.get(text);
        if (known != null) {
            return known;
        }
        return text.isBlank() ? List.of() : List.of(OTHER);
    }
}
