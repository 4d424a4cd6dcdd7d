package com.coffeejournal.store.migration;

import com.coffeejournal.store.repository.AtomicFiles;
import com.coffeejournal.store.repository.CollectionCodec;
import com.coffeejournal.store.repository.StorageException;
import com.coffeejournal.store.repository.Timestamps;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Brings one tenant data directory up to the program's schema version.
 * <p>
 * Key properties:
 * - The data version marker is only rewritten after every step on the path succeeded.
 * - Only direct {@code from->to} edges are resolved; there is no chaining across versions.
 * - A backup copy of the directory is taken before any step that rewrites records.
 * </p>
 */
@Slf4j
public class MigrationManager {

    public static final String DATA_VERSION_FILE = "data_version.json";
    public static final String BASELINE_DATA_VERSION = "1.0";
    public static final String NO_SCHEMA_VERSION = "0.0";
    public static final String BACKUP_PREFIX = "backup_";
    /** Tenant directories live below the default tenant's directory and are migrated on their own. */
    public static final String TENANTS_DIR = "users";

    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path dataDir;
    private final Path schemaVersionFile;
    private final Map<String, Migration> migrations = new LinkedHashMap<>();
    private final Clock clock;

    public MigrationManager(Path dataDir, Path schemaVersionFile, Collection<? extends Migration> migrations, Clock clock) {
        this.dataDir = dataDir;
        this.schemaVersionFile = schemaVersionFile;
        this.clock = clock;
        migrations.forEach(this::register);
    }

    public void register(Migration migration) {
        Migration previous = migrations.put(migration.key(), migration);
        if (previous != null) {
            log.warn("Migration {} replaced an earlier registration", migration.key());
        }
    }

    public Map<String, Migration> getMigrations() {
        return Collections.unmodifiableMap(migrations);
    }

    /** @return the version the program expects, {@code 0.0} when it declares none */
    public String getSchemaVersion() {
        if (!Files.exists(schemaVersionFile)) {
            return NO_SCHEMA_VERSION;
        }
        try {
            JsonNode root = CollectionCodec.mapper().readTree(schemaVersionFile.toFile());
            JsonNode version = root == null ? null : root.get("schema_version");
            return version == null || version.isNull() ? NO_SCHEMA_VERSION : version.asText();
        } catch (IOException e) {
            log.warn("Could not read schema version from {}: {}", schemaVersionFile, e.getMessage());
            return NO_SCHEMA_VERSION;
        }
    }

    /** @return the version of the data on disk, {@code 1.0} when no marker exists */
    public String getDataVersion() {
        Path marker = dataDir.resolve(DATA_VERSION_FILE);
        if (!Files.exists(marker)) {
            return BASELINE_DATA_VERSION;
        }
        try {
            VersionMarker content = CollectionCodec.mapper().readValue(marker.toFile(), VersionMarker.class);
            return content == null || content.getVersion() == null ? BASELINE_DATA_VERSION : content.getVersion();
        } catch (IOException e) {
            throw new StorageException("Data version marker " + marker + " is unreadable", e);
        }
    }

    public void setDataVersion(String version, String description) {
        VersionMarker marker = new VersionMarker(version, Timestamps.now(clock), description);
        try {
            AtomicFiles.write(dataDir.resolve(DATA_VERSION_FILE),
                    CollectionCodec.mapper().writeValueAsBytes(marker));
        } catch (IOException e) {
            throw new StorageException("Failed to write data version marker in " + dataDir, e);
        }
        log.info("Data version of {} set to {}", dataDir, version);
    }

    /**
     * Stamp a directory that holds no collections yet with the schema version, so new tenants
     * start current instead of at the baseline.
     * @return true if the marker was written
     */
    public boolean initializeIfFresh() {
        if (Files.exists(dataDir.resolve(DATA_VERSION_FILE))) {
            return false;
        }
        String target = getSchemaVersion();
        if (NO_SCHEMA_VERSION.equals(target)) {
            return false;
        }
        if (Files.isDirectory(dataDir)) {
            try (Stream<Path> entries = Files.list(dataDir)) {
                if (entries.anyMatch(p -> p.getFileName().toString().endsWith(".json"))) {
                    return false;
                }
            } catch (IOException e) {
                throw new StorageException("Failed to inspect " + dataDir, e);
            }
        }
        setDataVersion(target, "New data directory created at version " + target);
        return true;
    }

    public boolean needsMigration() {
        return SemanticVersion.parse(getDataVersion()).isBefore(SemanticVersion.parse(getSchemaVersion()));
    }

    /** @return the direct step between the versions, or an empty list when none is registered */
    public List<Migration> getMigrationPath(String from, String to) {
        Migration direct = migrations.get(from + "->" + to);
        if (direct == null) {
            log.warn("No migration path found from {} to {}", from, to);
            return List.of();
        }
        return List.of(direct);
    }

    /**
     * Run every step needed to reach the schema version.
     * Returns normally when the data is already current.
     * @throws MigrationException when no path exists or a step fails; the marker is untouched
     */
    public void runMigrations() {
        String from = getDataVersion();
        String to = getSchemaVersion();
        if (!SemanticVersion.parse(from).isBefore(SemanticVersion.parse(to))) {
            log.debug("Data in {} is at {}, no migration needed", dataDir, from);
            return;
        }
        List<Migration> path = getMigrationPath(from, to);
        if (path.isEmpty()) {
            throw new MigrationException("No migration path from " + from + " to " + to + " for " + dataDir);
        }
        log.info("Migrating {} from {} to {}", dataDir, from, to);
        if (path.stream().anyMatch(Migration::requiresBackup)) {
            try {
                Path backup = backupData();
                log.info("Backed up {} to {}", dataDir, backup);
            } catch (IOException | StorageException e) {
                log.warn("Backup of {} failed, continuing with migration: {}", dataDir, e.getMessage());
            }
        } else {
            log.info("Skipping backup, every step on the path is additive");
        }
        for (Migration migration : path) {
            log.info("Applying migration {}: {}", migration.key(), migration.description());
            try {
                migration.apply(dataDir);
            } catch (IOException | RuntimeException e) {
                log.error("Migration {} failed for {}", migration.key(), dataDir, e);
                throw new MigrationException("Migration " + migration.key() + " failed for " + dataDir, e);
            }
        }
        setDataVersion(to, "Data migrated to version " + to);
        log.info("Migration of {} to {} completed", dataDir, to);
    }

    /**
     * Copy the whole data directory, except earlier backups and tenant directories, into
     * {@code backup_<yyyyMMdd_HHmmss>} inside it.
     * @return the backup directory
     */
    public Path backupData() throws IOException {
        String stamp = BACKUP_STAMP.format(clock.instant());
        Path backup = dataDir.resolve(BACKUP_PREFIX + stamp);
        for (int n = 1; Files.exists(backup); n++) {
            backup = dataDir.resolve(BACKUP_PREFIX + stamp + "_" + n);
        }
        Files.createDirectories(dataDir);
        AtomicFiles.copyTree(dataDir, backup, entry -> isBackupCandidate(entry.getFileName().toString()));
        return backup;
    }

    public Path getDataDir() {
        return dataDir;
    }

    private static boolean isBackupCandidate(String name) {
        return !name.startsWith(BACKUP_PREFIX);
    }
}
