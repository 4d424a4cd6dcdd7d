package com.coffeejournal.store.repository;

import com.coffeejournal.store.lock.CollectionLock;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.model.EntityRepository;
import com.coffeejournal.store.schema.SchemaRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * One collection persisted as a JSON array in a single file.
 * <p>
 * Key properties:
 * - Every read and every read-modify-write cycle holds the collection lock for its whole duration.
 * - Writes replace the file atomically; readers never observe a partial file.
 * - Parsed content is cached and reused while the file stamp is unchanged.
 * - Ids are never reused: the highest id ever assigned is kept beside the collection.
 * - Modeled collections are stripped to their declared fields and validated before any write.
 * </p>
 */
@Slf4j
public class JsonRepository implements EntityRepository {

    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(10);

    protected final String collectionName;
    protected final SchemaRegistry schemas;
    protected final Clock clock;
    private final Path file;
    private final CollectionLock lock;
    private final Duration readTimeout;
    private final Duration writeTimeout;
    private final CollectionCache cache = new CollectionCache();
    private final IdHighWaterMark idMark;

    public JsonRepository(String collectionName, Path file, CollectionLock lock,
                          Duration readTimeout, Duration writeTimeout,
                          SchemaRegistry schemas, Clock clock) {
        this.collectionName = collectionName;
        this.file = file;
        this.lock = lock;
        this.readTimeout = readTimeout;
        this.writeTimeout = writeTimeout;
        this.schemas = schemas;
        this.clock = clock;
        this.idMark = new IdHighWaterMark(file);
    }

    /** Repository over {@code <dataDir>/<collectionName>.json} with the default lock timeouts. */
    public JsonRepository(String collectionName, Path dataDir, Path lockDir, SchemaRegistry schemas, Clock clock) {
        this(collectionName, dataDir.resolve(collectionName + ".json"),
                new CollectionLock(dataDir.resolve(collectionName + ".json"), lockDir),
                DEFAULT_READ_TIMEOUT, DEFAULT_WRITE_TIMEOUT, schemas, clock);
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public EntityRecord create(Map<String, ?> input) {
        EntityRecord incoming = EntityRecord.of(input);
        return modify(records -> Mutation.changed(insert(records, incoming)));
    }

    @Override
    public Optional<EntityRecord> update(long id, Map<String, ?> input) {
        EntityRecord incoming = EntityRecord.of(input);
        return modify(records -> {
            int index = indexOf(records, id);
            if (index < 0) {
                return Mutation.unchanged(Optional.<EntityRecord>empty());
            }
            EntityRecord existing = records.get(index);
            EntityRecord merged = schemas.stripUnknownFields(collectionName, existing)
                    .merge(schemas.stripUnknownFields(collectionName, incoming));
            String now = Timestamps.now(clock);
            merged.put(EntityRecord.ID, existing.get(EntityRecord.ID));
            merged.put(EntityRecord.CREATED_AT,
                    existing.has(EntityRecord.CREATED_AT) ? existing.get(EntityRecord.CREATED_AT) : now);
            merged.put(EntityRecord.UPDATED_AT, now);
            schemas.validate(collectionName, merged);
            beforeStore(records, merged);
            records.set(index, merged);
            log.debug("Updated {} record {}", collectionName, id);
            return Mutation.changed(Optional.of(merged.deepCopy()));
        });
    }

    @Override
    public boolean delete(long id) {
        return this.<Boolean>modify(records -> {
            boolean removed = records.removeIf(r -> r.hasId(id));
            if (removed) {
                log.debug("Deleted {} record {}", collectionName, id);
            }
            return new Mutation<>(removed, removed);
        });
    }

    @Override
    public Optional<EntityRecord> findById(long id) {
        return load().stream().filter(r -> r.hasId(id)).findFirst();
    }

    @Override
    public List<EntityRecord> findAll() {
        return load();
    }

    @Override
    public List<EntityRecord> findByField(String field, Object value) {
        return load().stream().filter(r -> r.fieldEquals(field, value)).toList();
    }

    @Override
    public int deleteByField(String field, Object value) {
        return this.<Integer>modify(records -> {
            int before = records.size();
            records.removeIf(r -> r.fieldEquals(field, value));
            int removed = before - records.size();
            if (removed > 0) {
                log.debug("Deleted {} {} records where {}={}", removed, collectionName, field, value);
            }
            return new Mutation<>(removed, removed > 0);
        });
    }

    /**
     * Scalar references are set to null; list references lose the matching element.
     * Every changed record is validated, so a required reference cannot be cleared.
     */
    @Override
    public int clearReferences(String field, long id) {
        return this.<Integer>modify(records -> {
            int changed = 0;
            String now = Timestamps.now(clock);
            for (EntityRecord record : records) {
                if (!record.references(field, id)) {
                    continue;
                }
                if (record.get(field) instanceof List<?> list) {
                    List<Object> kept = new ArrayList<>(list);
                    kept.removeIf(item -> item instanceof Number n && n.longValue() == id);
                    record.put(field, kept);
                } else {
                    record.put(field, null);
                }
                record.put(EntityRecord.UPDATED_AT, now);
                schemas.validate(collectionName, record);
                changed++;
            }
            if (changed > 0) {
                log.debug("Cleared {} references to {} in {}.{}", changed, id, collectionName, field);
            }
            return new Mutation<>(changed, changed > 0);
        });
    }

    @Override
    public void invalidate() {
        cache.invalidate();
    }

    /**
     * Strip, assign the next id, stamp and validate a new record, then append it.
     * Must run inside {@link #modify}.
     */
    protected EntityRecord insert(List<EntityRecord> records, EntityRecord incoming) {
        EntityRecord body = schemas.stripUnknownFields(collectionName, incoming);
        body.remove(EntityRecord.ID);
        body.remove(EntityRecord.CREATED_AT);
        body.remove(EntityRecord.UPDATED_AT);

        String now = Timestamps.now(clock);
        EntityRecord stored = EntityRecord.empty()
                .put(EntityRecord.ID, Math.max(maxId(records), idMark.read()) + 1)
                .merge(body)
                .put(EntityRecord.CREATED_AT, now)
                .put(EntityRecord.UPDATED_AT, now);
        schemas.validate(collectionName, stored);
        beforeStore(records, stored);
        records.add(stored);
        log.debug("Created {} record {}", collectionName, stored.getId());
        return stored.deepCopy();
    }

    /**
     * Hook run after a record passed validation and before it joins the collection.
     * May adjust other records of the same cycle.
     */
    protected void beforeStore(List<EntityRecord> records, EntityRecord stored) {
    }

    /** Read the collection under the lock. The returned list and records are owned by the caller. */
    protected List<EntityRecord> load() {
        try (CollectionLock.Held ignored = lock.acquire(readTimeout)) {
            return readLocked();
        }
    }

    /**
     * Run one read-modify-write cycle under the lock. The function may mutate the list
     * in place; it is written back only when the mutation reports a change.
     */
    protected <T> T modify(Function<List<EntityRecord>, Mutation<T>> change) {
        try (CollectionLock.Held ignored = lock.acquire(writeTimeout)) {
            List<EntityRecord> records = readLocked();
            Mutation<T> mutation = change.apply(records);
            if (mutation.changed()) {
                writeLocked(records);
            }
            return mutation.result();
        }
    }

    private List<EntityRecord> readLocked() {
        Optional<FileStamp> stamp = FileStamp.of(file);
        if (stamp.isEmpty()) {
            cache.invalidate();
            return new ArrayList<>();
        }
        Optional<List<EntityRecord>> cached = cache.get(stamp.get());
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            List<EntityRecord> records = CollectionCodec.decode(Files.readAllBytes(file));
            cache.put(records, stamp.get());
            log.debug("Loaded {} {} records from {}", records.size(), collectionName, file);
            return records;
        } catch (NoSuchFileException e) {
            cache.invalidate();
            return new ArrayList<>();
        } catch (IOException e) {
            log.error("Collection file {} is unreadable", file, e);
            throw new StorageException("Collection file " + file + " is unreadable", e);
        }
    }

    private void writeLocked(List<EntityRecord> records) {
        idMark.advanceTo(maxId(records));
        try {
            AtomicFiles.write(file, CollectionCodec.encode(records));
        } catch (StorageException e) {
            cache.invalidate();
            throw e;
        }
        Optional<FileStamp> stamp = FileStamp.of(file);
        if (stamp.isPresent()) {
            cache.put(records, stamp.get());
        } else {
            cache.invalidate();
        }
    }

    private static int indexOf(List<EntityRecord> records, long id) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).hasId(id)) {
                return i;
            }
        }
        return -1;
    }

    private static long maxId(List<EntityRecord> records) {
        long max = 0;
        for (EntityRecord record : records) {
            Long id = record.getId();
            if (id != null && id > max) {
                max = id;
            }
        }
        return max;
    }

    /** Outcome of one {@link #modify} cycle. */
    protected record Mutation<T>(T result, boolean changed) {
        static <T> Mutation<T> changed(T result) {
            return new Mutation<>(result, true);
        }

        static <T> Mutation<T> unchanged(T result) {
            return new Mutation<>(result, false);
        }
    }
}
