package com.coffeejournal.store.migration;

import com.coffeejournal.store.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MigrationManagerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.at("2025-03-01T08:00:00Z");
    private Path dataDir;
    private Path schemaFile;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        schemaFile = tempDir.resolve("schema_version.json");
    }

    private void schemaVersion(String version) throws IOException {
        Files.writeString(schemaFile, "{\"schema_version\": \"" + version + "\"}");
    }

    private void dataVersion(String version) throws IOException {
        Files.writeString(dataDir.resolve("data_version.json"), "{\"version\": \"" + version + "\"}");
    }

    private List<String> backups() throws IOException {
        try (Stream<Path> entries = Files.list(dataDir)) {
            return entries.map(p -> p.getFileName().toString()).filter(n -> n.startsWith("backup_")).toList();
        }
    }

    /** Creates two empty collections X and Y. */
    private static Migration createCollections(boolean backup, List<String> calls) {
        return new Migration() {
            @Override
            public String fromVersion() {
                return "1.3";
            }

            @Override
            public String toVersion() {
                return "1.4";
            }

            @Override
            public String description() {
                return "create X and Y";
            }

            @Override
            public boolean requiresBackup() {
                return backup;
            }

            @Override
            public void apply(Path dataDir) throws IOException {
                calls.add(key());
                for (String name : List.of("x.json", "y.json")) {
                    if (!Files.exists(dataDir.resolve(name))) {
                        Files.writeString(dataDir.resolve(name), "[]");
                    }
                }
            }
        };
    }

    @Test
    void testDefaultsWhenMarkersAreMissing() {
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(), clock);

        assertEquals("0.0", manager.getSchemaVersion());
        assertEquals("1.0", manager.getDataVersion());
        assertFalse(manager.needsMigration());
        assertDoesNotThrow(manager::runMigrations);
    }

    @Test
    void testMigratesAndCreatesCollections() throws IOException {
        schemaVersion("1.4");
        dataVersion("1.3");
        List<String> calls = new ArrayList<>();
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(createCollections(false, calls)), clock);
        assertTrue(manager.needsMigration());

        manager.runMigrations();

        assertEquals("1.4", manager.getDataVersion());
        assertFalse(manager.needsMigration());
        assertEquals("[]", Files.readString(dataDir.resolve("x.json")));
        assertEquals("[]", Files.readString(dataDir.resolve("y.json")));
        assertEquals(List.of("1.3->1.4"), calls);
        assertTrue(backups().isEmpty());
        assertTrue(Files.readString(dataDir.resolve("data_version.json")).contains("\"migrated_at\""));
    }

    @Test
    void testSecondRunChangesNothing() throws IOException {
        schemaVersion("1.4");
        dataVersion("1.3");
        Files.writeString(dataDir.resolve("products.json"), "[]");
        List<String> calls = new ArrayList<>();
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(createCollections(true, calls)), clock);

        manager.runMigrations();
        assertEquals(1, backups().size());
        String marker = Files.readString(dataDir.resolve("data_version.json"));

        clock.advance(Duration.ofMinutes(1));
        manager.runMigrations();

        assertEquals(1, backups().size());
        assertEquals(1, calls.size());
        assertEquals(marker, Files.readString(dataDir.resolve("data_version.json")));
    }

    @Test
    void testFailureLeavesMarkerUnchanged() throws IOException {
        schemaVersion("1.6");
        dataVersion("1.5");
        Migration failing = new Migration() {
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
                return "always fails";
            }

            @Override
            public void apply(Path dataDir) throws IOException {
                throw new IOException("disk on fire");
            }
        };
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(failing), clock);

        MigrationException e = assertThrows(MigrationException.class, manager::runMigrations);

        assertTrue(e.getMessage().contains("1.5->1.6"));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("1.5", manager.getDataVersion());
        assertEquals(1, backups().size(), "backup stays available for recovery");
    }

    @Test
    void testNoMultiHopPath() throws IOException {
        schemaVersion("1.5");
        dataVersion("1.3");
        MigrationManager manager = new MigrationManager(dataDir, schemaFile,
                List.of(createCollections(false, new ArrayList<>())), clock);

        assertTrue(manager.getMigrationPath("1.3", "1.5").isEmpty());
        assertEquals(1, manager.getMigrationPath("1.3", "1.4").size());
        assertThrows(MigrationException.class, manager::runMigrations);
        assertEquals("1.3", manager.getDataVersion());
    }

    @Test
    void testBackupCopiesEverythingButOlderBackups() throws IOException {
        Files.writeString(dataDir.resolve("products.json"), "[{\"id\": 1}]");
        Files.createDirectories(dataDir.resolve("nested"));
        Files.writeString(dataDir.resolve("nested/file.txt"), "content");
        Files.createDirectories(dataDir.resolve("backup_20240101_000000"));
        Files.createDirectories(dataDir.resolve("users/alice"));
        Files.writeString(dataDir.resolve("users/alice/products.json"), "[]");
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(), clock);

        Path backup = manager.backupData();
        Path second = manager.backupData();

        assertEquals("backup_20250301_080000", backup.getFileName().toString());
        assertNotEquals(backup, second);
        assertEquals("[{\"id\": 1}]", Files.readString(backup.resolve("products.json")));
        assertEquals("content", Files.readString(backup.resolve("nested/file.txt")));
        assertFalse(Files.exists(backup.resolve("backup_20240101_000000")));
        assertEquals("[]", Files.readString(backup.resolve("users/alice/products.json")));
        assertFalse(Files.exists(second.resolve(backup.getFileName().toString())));
    }

    @Test
    void testFreshDirectoryStartsAtSchemaVersion() throws IOException {
        schemaVersion("1.6");
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(), clock);

        assertTrue(manager.initializeIfFresh());
        assertEquals("1.6", manager.getDataVersion());
        assertFalse(manager.initializeIfFresh());

        Path other = Files.createDirectories(tempDir.resolve("other"));
        Files.writeString(other.resolve("products.json"), "[]");
        assertFalse(new MigrationManager(other, schemaFile, List.of(), clock).initializeIfFresh());
    }

    @Test
    void testSemanticOrdering() {
        assertTrue(SemanticVersion.parse("1.9").isBefore(SemanticVersion.parse("1.10")));
        assertEquals(SemanticVersion.parse("1.4"), SemanticVersion.parse("1.4.0"));
        assertEquals(SemanticVersion.parse("1.4").hashCode(), SemanticVersion.parse("1.4.0").hashCode());
        assertFalse(SemanticVersion.parse("2.0").isBefore(SemanticVersion.parse("1.6")));
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("1.x"));
    }

    @Test
    void testRegisterReplacesSameEdge() {
        MigrationManager manager = new MigrationManager(dataDir, schemaFile, List.of(), clock);
        List<String> calls = new ArrayList<>();
        manager.register(createCollections(true, calls));
        Migration replacement = createCollections(false, calls);
        manager.register(replacement);

        assertEquals(Map.of("1.3->1.4", replacement), manager.getMigrations());
    }
}
