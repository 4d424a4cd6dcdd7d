package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.MutableClock;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.repository.CollectionCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MigrationStepsTest {

    @TempDir
    Path dataDir;

    private final MutableClock clock = MutableClock.at("2025-03-01T08:00:00Z");

    private List<EntityRecord> read(String collection) throws IOException {
        return CollectionCodec.decode(Files.readAllBytes(dataDir.resolve(collection + ".json")));
    }

    private void write(String collection, String json) throws IOException {
        Files.writeString(dataDir.resolve(collection + ".json"), json);
    }

    @Test
    void testRegionsExtractedFromProducts() throws IOException {
        write("products", """
                [
                  {"id": 1, "product_name": "A", "country_id": 1, "country": "Kenya", "region": "Nyeri",
                   "roaster": "Koppi", "bean_type_id": 2},
                  {"id": 2, "product_name": "B", "country_id": 2, "region": "Guji", "bean_type_id": [1, 3]},
                  {"id": 3, "product_name": "C", "country_id": 1, "region": "Nyeri"},
                  {"id": 4, "product_name": "D", "region": "  "}
                ]
                """);

        new RegionsTableMigration(clock).apply(dataDir);

        List<EntityRecord> regions = read("regions");
        assertEquals(2, regions.size());
        assertEquals("Guji", regions.get(0).getString("name"));
        assertEquals(2L, regions.get(0).getLong("country_id"));
        assertEquals("Nyeri", regions.get(1).getString("name"));
        assertEquals("2025-03-01T08:00:00.000000Z", regions.get(1).getCreatedAt());

        List<EntityRecord> products = read("products");
        assertEquals(List.of(2L), products.get(0).get("region_id"));
        assertEquals(List.of(2L), products.get(0).get("bean_type_id"));
        assertEquals(List.of(1L, 3L), products.get(1).get("bean_type_id"));
        assertEquals(List.of(2L), products.get(2).get("region_id"));
        assertEquals(List.of(), products.get(3).get("region_id"));
        for (EntityRecord product : products) {
            for (String field : RegionsTableMigration.DENORMALIZED_FIELDS) {
                assertFalse(product.has(field), field);
            }
        }
    }

    @Test
    void testRegionsMigrationSkipsWhenAlreadyApplied() throws IOException {
        write("products", "[{\"id\": 1, \"product_name\": \"A\", \"country_id\": 1, \"region\": \"Nyeri\"}]");
        write("regions", "[]");

        new RegionsTableMigration(clock).apply(dataDir);

        assertTrue(read("regions").isEmpty());
        assertEquals("Nyeri", read("products").get(0).getString("region"));
    }

    @Test
    void testRegionsMigrationToleratesFreshData() throws IOException {
        new RegionsTableMigration(clock).apply(dataDir);
        assertFalse(Files.exists(dataDir.resolve("regions.json")));
    }

    @Test
    void testEspressoCollectionsCreatedOnlyWhenMissing() throws IOException {
        write("shots", "[{\"id\": 1, \"dose_grams\": 18, \"yield_grams\": 36}]");

        EspressoCollectionsMigration migration = new EspressoCollectionsMigration();
        migration.apply(dataDir);
        migration.apply(dataDir);

        assertFalse(migration.requiresBackup());
        assertEquals(1, read("shots").size());
        for (String collection : EspressoCollectionsMigration.NEW_COLLECTIONS) {
            assertTrue(Files.exists(dataDir.resolve(collection + ".json")), collection);
        }
        assertTrue(read("leveling_tools").isEmpty());
    }

    @Test
    void testBeanProcessConvertedToArrays() throws IOException {
        write("products", """
                [
                  {"id": 1, "bean_process": "Washed"},
                  {"id": 2, "bean_process": "Natural/Anaerobic"},
                  {"id": 3, "bean_process": "Vasket"},
                  {"id": 4, "bean_process": ""},
                  {"id": 5, "bean_process": null},
                  {"id": 6, "bean_process": "Wet-hulled experiment"},
                  {"id": 7, "bean_process": ["Honey"]},
                  {"id": 8, "product_name": "no process"}
                ]
                """);

        BeanProcessArrayMigration migration = new BeanProcessArrayMigration();
        migration.apply(dataDir);
        migration.apply(dataDir);

        List<EntityRecord> products = read("products");
        assertEquals(List.of("Washed (wet)"), products.get(0).get("bean_process"));
        assertEquals(List.of("Natural (dry)", "Anaerobic"), products.get(1).get("bean_process"));
        assertEquals(List.of("Washed (wet)"), products.get(2).get("bean_process"));
        assertEquals(List.of(), products.get(3).get("bean_process"));
        assertEquals(List.of(), products.get(4).get("bean_process"));
        assertEquals(List.of("Other"), products.get(5).get("bean_process"));
        assertEquals(List.of("Honey"), products.get(6).get("bean_process"));
        assertFalse(products.get(7).has("bean_process"));
    }

    @Test
    void testBeanProcessMapping() {
        assertEquals(List.of("Washed (wet)", "Natural (dry)"), BeanProcessArrayMigration.toArray("Washed, Natural"));
        assertEquals(List.of("Natural (dry)"), BeanProcessArrayMigration.toArray("Sun dried"));
        assertEquals(List.of("Other"), BeanProcessArrayMigration.toArray("Dried with and without fruit"));
        assertEquals(List.of(), BeanProcessArrayMigration.toArray("   "));
    }

    @Test
    void testDefaultMigrationsFormOneEdgePerRelease() {
        List<String> keys = DefaultMigrations.all(clock).stream().map(m -> m.key()).toList();
        assertEquals(List.of("1.2->1.3", "1.3->1.4", "1.4->1.5", "1.5->1.6"), keys);
    }
}
