package com.coffeejournal.store.factory;

import com.coffeejournal.store.lock.CollectionLock;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.model.EntityRepository;
import com.coffeejournal.store.model.EntityType;
import com.coffeejournal.store.model.LookupRepository;
import com.coffeejournal.store.repository.AtomicFiles;
import com.coffeejournal.store.repository.JsonLookupRepository;
import com.coffeejournal.store.repository.JsonRepository;
import com.coffeejournal.store.repository.StorageException;
import com.coffeejournal.store.schema.SchemaRegistry;
import com.coffeejournal.store.smartdefault.UsagePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Entry point of the store: hands out one repository per (tenant, collection) and manages
 * tenant directories.
 * <p>
 * Key properties:
 * - The default tenant (a null id) lives directly in the base directory, every other tenant
 *   in {@code <base>/users/<tenant>}.
 * - Tenant ids are checked against a strict allowlist before they are turned into paths.
 * - Directory creation and removal are retried with a short linear backoff.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryFactory {

    public static final String TENANTS_DIR = "users";
    private static final String DEFAULT_TENANT_KEY = "<default>";
    private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final int MAX_ATTEMPTS = 3;
    private static final long BACKOFF_MILLIS = 100;

    private final SchemaRegistry schemas;
    private final Clock clock;
    private final Map<String, JsonRepository> repositories = new ConcurrentHashMap<>();

    @Value("${store.data.dir:data}")
    private String baseDirPath;

    @Value("${store.lock.dir:}")
    private String lockDirPath;

    @Value("${store.lock.read-timeout.millis:5000}")
    private long readTimeoutMillis;

    @Value("${store.lock.write-timeout.millis:10000}")
    private long writeTimeoutMillis;

    @Value("${store.template.dir:test_data}")
    private String templateDirPath;

    @Value("${store.ephemeral.prefix:test_}")
    private String ephemeralPrefix;

    /** Repository of a modeled collection; lookup types get a {@link LookupRepository}. */
    public EntityRepository getRepository(String tenantId, EntityType type) {
        if (type.isLookup()) {
            return getLookupRepository(tenantId, type);
        }
        validateTenantId(tenantId);
        return repositories.computeIfAbsent(cacheKey(tenantId, type.getCollectionName()),
                key -> newRepository(tenantId, type.getCollectionName()));
    }

    public LookupRepository getLookupRepository(String tenantId, EntityType type) {
        if (!type.isLookup()) {
            throw new IllegalArgumentException(type.getCollectionName() + " is not a lookup collection");
        }
        validateTenantId(tenantId);
        return (LookupRepository) repositories.computeIfAbsent(cacheKey(tenantId, type.getCollectionName()),
                key -> newLookupRepository(tenantId, type));
    }

    /** Repository by collection name; names outside {@link EntityType} are stored without a schema. */
    public EntityRepository getRepository(String tenantId, String collectionName) {
        return EntityType.fromCollectionName(collectionName)
                .map(type -> getRepository(tenantId, type))
                .orElseGet(() -> {
                    if (collectionName == null || !TENANT_ID.matcher(collectionName).matches()) {
                        throw new IllegalArgumentException("Invalid collection name: " + collectionName);
                    }
                    validateTenantId(tenantId);
                    return repositories.computeIfAbsent(cacheKey(tenantId, collectionName),
                            key -> newRepository(tenantId, collectionName));
                });
    }

    /**
     * @throws IllegalArgumentException unless the id is made of letters, digits, dash and
     *                                  underscore only and does not start with a dash
     */
    public static void validateTenantId(String tenantId) {
        if (tenantId == null) {
            return;
        }
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id must not be empty");
        }
        if (tenantId.contains("..") || tenantId.startsWith(".")) {
            throw new IllegalArgumentException("Tenant id must not contain path traversal: " + tenantId);
        }
        if (tenantId.startsWith("-")) {
            throw new IllegalArgumentException("Tenant id must not start with '-': " + tenantId);
        }
        if (!TENANT_ID.matcher(tenantId).matches()) {
            throw new IllegalArgumentException(
                    "Tenant id may only contain letters, digits, '-' and '_': " + tenantId);
        }
    }

    /** Tenant directory, created on first use. */
    public Path getDataDir(String tenantId) {
        validateTenantId(tenantId);
        Path dir = resolveDataDir(tenantId);
        ensureDirectory(dir);
        return dir;
    }

    /** @return ids of every tenant that has a directory, sorted */
    public List<String> listTenants() {
        Path usersDir = getBaseDir().resolve(TENANTS_DIR);
        if (!Files.isDirectory(usersDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(usersDir)) {
            return entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(RepositoryFactory::isValidTenantId)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list tenants in " + usersDir, e);
        }
    }

    /**
     * Copy every {@code *.json} file of the template directory into the tenant directory.
     * @return number of files copied
     */
    public int initializeFromTemplate(String tenantId) {
        Path target = getDataDir(tenantId);
        Path template = Paths.get(templateDirPath);
        if (!Files.isDirectory(template)) {
            log.warn("Template directory {} does not exist, tenant {} starts empty", template, tenantKey(tenantId));
            return 0;
        }
        int copied = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(template, "*.json")) {
            for (Path file : files) {
                Files.copy(file, target.resolve(file.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
                copied++;
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize tenant " + tenantKey(tenantId) + " from " + template, e);
        }
        invalidateAllCaches(tenantId);
        log.info("Initialized tenant {} with {} files from {}", tenantKey(tenantId), copied, template);
        return copied;
    }

    /**
     * Remove a tenant's directory and every cached repository of it.
     * @return true if the directory existed
     */
    public boolean deleteTenant(String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("The default tenant cannot be deleted");
        }
        validateTenantId(tenantId);
        evict(tenantId);
        Path dir = resolveDataDir(tenantId);
        if (!Files.exists(dir)) {
            return false;
        }
        for (int attempt = 0; ; attempt++) {
            try {
                AtomicFiles.deleteTree(dir);
                log.info("Deleted tenant {}", tenantId);
                return true;
            } catch (IOException e) {
                if (attempt + 1 >= MAX_ATTEMPTS) {
                    throw new StorageException("Failed to delete tenant " + tenantId, e);
                }
                log.warn("Deleting tenant {} failed (attempt {}), retrying: {}", tenantId, attempt + 1, e.getMessage());
                backoff(attempt);
            }
        }
    }

    /** Delete every tenant whose id starts with the ephemeral prefix. */
    public int cleanupEphemeralTenants() {
        int removed = 0;
        for (String tenantId : listTenants()) {
            if (tenantId.startsWith(ephemeralPrefix) && deleteTenant(tenantId)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} ephemeral tenants", removed);
        }
        return removed;
    }

    /** Make every cached repository of the tenant, or of all tenants when null, re-read from disk. */
    public void invalidateAllCaches(String tenantId) {
        String prefix = tenantId == null ? null : tenantKey(tenantId) + ":";
        repositories.forEach((key, repository) -> {
            if (prefix == null || key.startsWith(prefix)) {
                repository.invalidate();
            }
        });
        log.debug("Invalidated caches for {}", tenantId == null ? "all tenants" : tenantId);
    }

    public Path getBaseDir() {
        return Paths.get(baseDirPath);
    }

    private JsonRepository newRepository(String tenantId, String collectionName) {
        Path file = getDataDir(tenantId).resolve(collectionName + ".json");
        log.debug("Creating repository for {}:{}", tenantKey(tenantId), collectionName);
        return new JsonRepository(collectionName, file, new CollectionLock(file, getLockDir()),
                Duration.ofMillis(readTimeoutMillis), Duration.ofMillis(writeTimeoutMillis), schemas, clock);
    }

    private JsonLookupRepository newLookupRepository(String tenantId, EntityType type) {
        Path file = getDataDir(tenantId).resolve(type.getFileName());
        log.debug("Creating lookup repository for {}:{}", tenantKey(tenantId), type.getCollectionName());
        return new JsonLookupRepository(type.getCollectionName(), file, new CollectionLock(file, getLockDir()),
                Duration.ofMillis(readTimeoutMillis), Duration.ofMillis(writeTimeoutMillis), schemas, clock,
                type.getScopeField().orElse(null),
                UsagePolicy.forType(type).orElse(null),
                source -> usageOf(tenantId, source));
    }

    private List<EntityRecord> usageOf(String tenantId, String collectionName) {
        return getRepository(tenantId, collectionName).findAll();
    }

    private Path resolveDataDir(String tenantId) {
        Path base = getBaseDir();
        return tenantId == null ? base : base.resolve(TENANTS_DIR).resolve(tenantId);
    }

    private Path getLockDir() {
        return lockDirPath == null || lockDirPath.isBlank() ? CollectionLock.defaultLockDir() : Paths.get(lockDirPath);
    }

    private void ensureDirectory(Path dir) {
        for (int attempt = 0; ; attempt++) {
            try {
                Files.createDirectories(dir);
                return;
            } catch (IOException e) {
                if (Files.isDirectory(dir)) {
                    return;
                }
                if (attempt + 1 >= MAX_ATTEMPTS) {
                    throw new StorageException("Failed to create data directory " + dir, e);
                }
                log.warn("Creating {} failed (attempt {}), retrying: {}", dir, attempt + 1, e.getMessage());
                backoff(attempt);
            }
        }
    }

    private void evict(String tenantId) {
        String prefix = tenantKey(tenantId) + ":";
        List<String> keys = new ArrayList<>();
        repositories.keySet().forEach(key -> {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        });
        keys.forEach(key -> {
            JsonRepository removed = repositories.remove(key);
            if (removed != null) {
                removed.invalidate();
            }
        });
    }

    private static void backoff(int attempt) {
        try {
            Thread.sleep(BACKOFF_MILLIS * (attempt + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying a directory operation", e);
        }
    }

    private static boolean isValidTenantId(String tenantId) {
        try {
            validateTenantId(tenantId);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String tenantKey(String tenantId) {
        return tenantId == null ? DEFAULT_TENANT_KEY : tenantId;
    }

    private static String cacheKey(String tenantId, String collectionName) {
        return tenantKey(tenantId) + ":" + collectionName;
    }
}
