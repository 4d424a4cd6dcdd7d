package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.repository.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 1.2 to 1.3: regions become their own lookup collection scoped by country.
 * <p>
 * Region names embedded in products are collected into {@code regions.json}, products then
 * reference them through a {@code region_id} array. {@code bean_type_id} becomes an array
 * as well, and the denormalized name copies are dropped from products.
 * </p>
 */
@Slf4j
public class RegionsTableMigration extends CollectionFileMigration {

    static final List<String> DENORMALIZED_FIELDS = List.of("roaster", "bean_type", "country", "region", "decaf_method");

    private final Clock clock;

    public RegionsTableMigration(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String fromVersion() {
        return "1.2";
    }

    @Override
    public String toVersion() {
        return "1.3";
    }

    @Override
    public String description() {
        return "Separate regions into their own lookup table with a country_id parent reference";
    }

    @Override
    public void apply(Path dataDir) throws IOException {
        if (exists(dataDir, "regions")) {
            log.info("regions.json already present in {}, skipping region extraction", dataDir);
            return;
        }
        Optional<List<EntityRecord>> loaded = read(dataDir, "products");
        if (loaded.isEmpty()) {
            log.info("No products in {}, nothing to extract", dataDir);
            return;
        }
        List<EntityRecord> products = loaded.get();

        Map<String, Object> countryByRegion = new TreeMap<>();
        for (EntityRecord product : products) {
            String region = product.getString("region");
            Object countryId = product.get("country_id");
            if (region != null && !region.isBlank() && countryId != null) {
                countryByRegion.putIfAbsent(region, countryId);
            }
        }

        String now = Timestamps.now(clock);
        List<EntityRecord> regions = new ArrayList<>();
        Map<String, Long> idByRegion = new TreeMap<>();
        long nextId = 1;
        for (Map.Entry<String, Object> entry : countryByRegion.entrySet()) {
            regions.add(EntityRecord.of(
                    EntityRecord.ID, nextId,
                    "name", entry.getKey(),
                    "country_id", entry.getValue(),
                    "is_default", false,
                    EntityRecord.CREATED_AT, now,
                    EntityRecord.UPDATED_AT, now));
            idByRegion.put(entry.getKey(), nextId);
            nextId++;
        }

        int linked = 0;
        for (EntityRecord product : products) {
            String region = product.getString("region");
            if (region != null && idByRegion.containsKey(region)) {
                product.put("region_id", List.of(idByRegion.get(region)));
                linked++;
            } else {
                product.put("region_id", asIdList(product.get("region_id")));
            }
            if (product.has("bean_type_id")) {
                product.put("bean_type_id", asIdList(product.get("bean_type_id")));
            }
            DENORMALIZED_FIELDS.forEach(product::remove);
        }

        write(dataDir, "regions", regions);
        write(dataDir, "products", products);
        log.info("Extracted {} regions and linked {} products in {}", regions.size(), linked, dataDir);
    }

    private static List<Object> asIdList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        List<Object> ids = new ArrayList<>();
        if (value instanceof Number) {
            ids.add(value);
        }
        return ids;
    }
}
