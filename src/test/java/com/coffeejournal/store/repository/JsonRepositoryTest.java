package com.coffeejournal.store.repository;

import com.coffeejournal.store.MutableClock;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.schema.SchemaRegistry;
import com.coffeejournal.store.schema.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonRepositoryTest {

    @TempDir
    Path tempDir;

    private final SchemaRegistry schemas = new SchemaRegistry();
    private MutableClock clock;
    private JsonRepository products;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T08:00:00Z");
        products = newRepository("products");
    }

    private JsonRepository newRepository(String collection) {
        return new JsonRepository(collection, tempDir, tempDir.resolve("locks"), schemas, clock);
    }

    @Test
    void testCreateAssignsIdsAndTimestamps() {
        EntityRecord first = products.create(Map.of("product_name", "Kenya AA"));
        clock.advance(Duration.ofSeconds(1));
        EntityRecord second = products.create(Map.of("product_name", "Ethiopia Guji", "id", 99));

        assertEquals(1L, first.getId());
        assertEquals(2L, second.getId());
        assertEquals("2025-03-01T08:00:00.000000Z", first.getCreatedAt());
        assertEquals(first.getCreatedAt(), first.getUpdatedAt());
        assertEquals("2025-03-01T08:00:01.000000Z", second.getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("products.json")));
    }

    @Test
    void testCreateThenFindByIdRoundTrip() {
        Map<String, Object> input = Map.of(
                "product_name", "Kenya AA",
                "roaster_id", 3,
                "bean_type_id", List.of(1, 2),
                "rating", 4.5,
                "decaf", false,
                "notes", "Blackcurrant");

        EntityRecord created = products.create(input);
        products.invalidate();
        EntityRecord found = products.findById(created.getId()).orElseThrow();

        assertEquals(created, found);
        EntityRecord expected = EntityRecord.of(input);
        for (String field : input.keySet()) {
            assertEquals(expected.get(field), found.get(field), field);
        }
    }

    @Test
    void testFindAllOnMissingFileIsEmpty() {
        assertTrue(products.findAll().isEmpty());
        assertTrue(products.findById(1).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("products.json")));
    }

    @Test
    void testUndeclaredFieldsNeverReachDisk() throws IOException {
        EntityRecord created = products.create(Map.of(
                "product_name", "Kenya AA",
                "roaster", Map.of("id", 1, "name", "Tim Wendelboe"),
                "roaster_name", "Tim Wendelboe"));
        products.update(created.getId(), Map.of("country", "Kenya", "roast_type", 3));

        String content = Files.readString(tempDir.resolve("products.json"));
        assertFalse(content.contains("\"roaster\""));
        assertFalse(content.contains("roaster_name"));
        assertFalse(content.contains("\"country\""));
        assertTrue(content.contains("\"roast_type\""));
    }

    @Test
    void testUpdateMergesAndPreservesIdentity() {
        EntityRecord created = products.create(Map.of("product_name", "Kenya AA", "notes", "old"));
        clock.advance(Duration.ofMinutes(5));

        EntityRecord updated = products.update(created.getId(),
                Map.of("notes", "new", "id", 42, "created_at", "2000-01-01T00:00:00Z")).orElseThrow();

        assertEquals(created.getId(), updated.getId());
        assertEquals("Kenya AA", updated.getString("product_name"));
        assertEquals("new", updated.getString("notes"));
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertEquals("2025-03-01T08:05:00.000000Z", updated.getUpdatedAt());
        assertEquals(updated, products.findById(created.getId()).orElseThrow());
    }

    @Test
    void testUpdateMissingIdIsEmpty() {
        assertEquals(Optional.empty(), products.update(7, Map.of("notes", "x")));
        assertFalse(Files.exists(tempDir.resolve("products.json")));
    }

    @Test
    void testInvalidCreateWritesNothing() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> products.create(Map.of("rating", 4.3)));

        assertTrue(e.getFieldErrors().containsKey("product_name"));
        assertTrue(e.getFieldErrors().containsKey("rating"));
        assertFalse(Files.exists(tempDir.resolve("products.json")));
    }

    @Test
    void testInvalidUpdateLeavesRecordUnchanged() {
        EntityRecord created = products.create(Map.of("product_name", "Kenya AA"));

        assertThrows(ValidationException.class, () -> products.update(created.getId(), Map.of("roast_type", 0)));

        assertEquals(created, products.findById(created.getId()).orElseThrow());
    }

    @Test
    void testDeleteAndIdsAreNeverReused() {
        products.create(Map.of("product_name", "A"));
        EntityRecord second = products.create(Map.of("product_name", "B"));

        assertTrue(products.delete(second.getId()));
        assertFalse(products.delete(second.getId()));

        EntityRecord third = products.create(Map.of("product_name", "C"));
        assertEquals(3L, third.getId());
        assertEquals(List.of(1L, 3L), products.findAll().stream().map(EntityRecord::getId).toList());
    }

    @Test
    void testReturnedRecordsAreDetached() {
        EntityRecord created = products.create(Map.of("product_name", "Kenya AA", "bean_type_id", List.of(1)));

        EntityRecord copy = products.findById(created.getId()).orElseThrow();
        copy.put("product_name", "changed");
        products.findAll().get(0).put("notes", "changed");

        assertEquals(created, products.findById(created.getId()).orElseThrow());
    }

    @Test
    void testFieldOperations() {
        JsonRepository batches = newRepository("batches");
        batches.create(Map.of("product_id", 1, "roast_date", "2025-02-01"));
        batches.create(Map.of("product_id", 2, "roast_date", "2025-02-02"));
        batches.create(Map.of("product_id", 1, "roast_date", "2025-02-03"));

        assertEquals(2, batches.findByField("product_id", 1L).size());
        assertEquals(2, batches.deleteByField("product_id", 1));
        assertEquals(0, batches.deleteByField("product_id", 1));
        assertEquals(List.of(2L), batches.findAll().stream().map(EntityRecord::getId).toList());
    }

    @Test
    void testClearReferences() {
        JsonRepository shots = newRepository("shots");
        shots.create(Map.of("dose_grams", 18, "yield_grams", 36, "shot_session_id", 4));
        shots.create(Map.of("dose_grams", 18, "yield_grams", 40, "shot_session_id", 5));
        products.create(Map.of("product_name", "Blend", "region_id", List.of(4, 7)));

        assertEquals(1, shots.clearReferences("shot_session_id", 4));
        assertEquals(1, products.clearReferences("region_id", 4));

        assertNull(shots.findById(1).orElseThrow().get("shot_session_id"));
        assertTrue(shots.findById(1).orElseThrow().has("shot_session_id"));
        assertEquals(5L, shots.findById(2).orElseThrow().getLong("shot_session_id"));
        assertEquals(List.of(7L), products.findById(1).orElseThrow().get("region_id"));
    }

    @Test
    void testClearingRequiredReferenceIsRejected() {
        JsonRepository batches = newRepository("batches");
        batches.create(Map.of("product_id", 3, "roast_date", "2025-02-20"));

        assertThrows(ValidationException.class, () -> batches.clearReferences("product_id", 3));

        batches.invalidate();
        assertEquals(3L, batches.findById(1).orElseThrow().getLong("product_id"));
    }

    @Test
    void testFailedIdMarkWriteStoresNothing() throws IOException {
        products.create(Map.of("product_name", "Kenya AA"));
        Path mark = tempDir.resolve("products.meta");
        Files.delete(mark);
        Files.createDirectories(mark.resolve("blocked"));

        assertThrows(StorageException.class, () -> products.create(Map.of("product_name", "Ethiopia Guji")));

        products.invalidate();
        assertEquals(1, products.findAll().size());
        assertEquals(1, newRepository("products").findAll().size());
    }

    @Test
    void testSeesExternalWrites() throws IOException {
        products.create(Map.of("product_name", "Cached"));
        assertEquals(1, products.findAll().size());

        Path file = tempDir.resolve("products.json");
        Files.writeString(file, "[{\"id\": 1, \"product_name\": \"External\"}, {\"id\": 2, \"product_name\": \"Second\"}]",
                StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));

        List<EntityRecord> all = products.findAll();
        assertEquals(2, all.size());
        assertEquals("External", all.get(0).getString("product_name"));
    }

    @Test
    void testSecondInstanceSeesWrites() {
        JsonRepository other = newRepository("products");
        assertTrue(other.findAll().isEmpty());

        products.create(Map.of("product_name", "Kenya AA"));

        assertEquals(1, other.findAll().size());
    }

    @Test
    void testCorruptFileIsAnError() throws IOException {
        Files.writeString(tempDir.resolve("products.json"), "[{\"id\": 1,");

        assertThrows(StorageException.class, () -> products.findAll());
        assertThrows(StorageException.class, () -> products.create(Map.of("product_name", "x")));
        assertEquals("[{\"id\": 1,", Files.readString(tempDir.resolve("products.json")));
    }

    @Test
    void testConcurrentCreatesThroughOneInstance() throws Exception {
        assertEquals(ids(40), createConcurrently(List.of(products), 40));
    }

    @Test
    void testConcurrentCreatesThroughTwoInstances() throws Exception {
        JsonRepository other = newRepository("products");
        assertEquals(ids(40), createConcurrently(List.of(products, other), 40));
        assertEquals(40, other.findAll().size());
    }

    @Test
    void testWritesLeaveNoTempFiles() throws IOException {
        for (int i = 0; i < 5; i++) {
            products.create(Map.of("product_name", "P" + i));
        }
        try (Stream<Path> files = Files.list(tempDir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
            assertEquals(List.of("locks", "products.json", "products.meta"), names);
        }
    }

    @Test
    void testAdHocCollectionSkipsSchema() {
        JsonRepository notes = newRepository("notes");
        EntityRecord created = notes.create(Map.of("anything", Map.of("nested", true)));

        assertEquals(1L, created.getId());
        assertEquals(Map.of("nested", true), notes.findById(1).orElseThrow().get("anything"));
    }

    private Set<Long> createConcurrently(List<JsonRepository> instances, int count) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<EntityRecord>> tasks = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                JsonRepository target = instances.get(i % instances.size());
                String name = "Product " + i;
                tasks.add(() -> target.create(Map.of("product_name", name)));
            }
            Set<Long> returned = new TreeSet<>();
            for (Future<EntityRecord> future : executor.invokeAll(tasks)) {
                returned.add(future.get().getId());
            }
            assertEquals(count, returned.size());
            return products.findAll().stream().map(EntityRecord::getId).collect(Collectors.toCollection(TreeSet::new));
        } finally {
            executor.shutdownNow();
        }
    }

    private static Set<Long> ids(int count) {
        return LongStream.rangeClosed(1, count).boxed().collect(Collectors.toCollection(TreeSet::new));
    }
}
