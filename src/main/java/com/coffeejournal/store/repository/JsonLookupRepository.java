package com.coffeejournal.store.repository;

import com.coffeejournal.store.lock.CollectionLock;
import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.model.LookupRepository;
import com.coffeejournal.store.schema.SchemaRegistry;
import com.coffeejournal.store.smartdefault.UsagePolicy;
import com.coffeejournal.store.smartdefault.UsageScorer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Lookup collection (roasters, grinders, regions...) with name dedup, a single manual
 * default and usage-based smart defaults.
 * <p>
 * At most one record carries {@code is_default=true}. Every path that can set the flag
 * (create, update, setDefault) clears it on the others inside the same locked cycle.
 * </p>
 */
@Slf4j
public class JsonLookupRepository extends JsonRepository implements LookupRepository {

    private final String scopeField;
    private final UsageScorer scorer;

    /**
     * @param scopeField  reference field that scopes name uniqueness, or null
     * @param policy      usage policy for smart defaults, or null to rank by creation order only
     * @param usageLoader loads the records of a collection of the same tenant by name
     */
    public JsonLookupRepository(String collectionName, Path file, CollectionLock lock,
                                Duration readTimeout, Duration writeTimeout,
                                SchemaRegistry schemas, Clock clock,
                                String scopeField, UsagePolicy policy,
                                Function<String, List<EntityRecord>> usageLoader) {
        super(collectionName, file, lock, readTimeout, writeTimeout, schemas, clock);
        this.scopeField = scopeField;
        this.scorer = policy == null ? null : new UsageScorer(policy, usageLoader);
    }

    @Override
    public Optional<EntityRecord> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return load().stream().filter(nameMatches(name)).findFirst();
    }

    @Override
    public Optional<EntityRecord> findByShortForm(String shortForm) {
        if (shortForm == null) {
            return Optional.empty();
        }
        return load().stream().filter(shortFormMatches(shortForm)).findFirst();
    }

    @Override
    public Optional<EntityRecord> findByNameOrShortForm(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        List<EntityRecord> records = load();
        Optional<EntityRecord> byName = records.stream().filter(nameMatches(identifier)).findFirst();
        return byName.isPresent() ? byName : records.stream().filter(shortFormMatches(identifier)).findFirst();
    }

    @Override
    public EntityRecord getOrCreate(String name, Map<String, ?> extra) {
        return getOrCreate(name, extra, nameMatches(name));
    }

    @Override
    public EntityRecord getOrCreateByIdentifier(String identifier, Map<String, ?> extra) {
        return getOrCreate(identifier, extra, nameMatches(identifier).or(shortFormMatches(identifier)));
    }

    private EntityRecord getOrCreate(String name, Map<String, ?> extra, Predicate<EntityRecord> matcher) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Lookup name must not be blank");
        }
        Map<String, ?> values = extra == null ? Map.<String, Object>of() : extra;
        EntityRecord input = EntityRecord.of(values).put(NAME, name.trim());
        Predicate<EntityRecord> inScope = inScope(input);
        return modify(records -> {
            Optional<EntityRecord> existing = records.stream()
                    .filter(matcher.and(inScope))
                    .findFirst();
            if (existing.isPresent()) {
                return Mutation.unchanged(existing.get());
            }
            EntityRecord created = insert(records, input);
            log.info("Created {} '{}' with id {}", collectionName, name.trim(), created.getId());
            return Mutation.changed(created);
        });
    }

    @Override
    public List<EntityRecord> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return load().stream()
                .filter(r -> contains(r.getString(NAME), needle) || contains(r.getString(SHORT_FORM), needle))
                .toList();
    }

    @Override
    public Optional<EntityRecord> findDefault() {
        return load().stream().filter(r -> r.isTrue(IS_DEFAULT)).findFirst();
    }

    @Override
    public Optional<EntityRecord> setDefault(long id) {
        return modify(records -> {
            if (records.stream().noneMatch(r -> r.hasId(id))) {
                return Mutation.unchanged(Optional.<EntityRecord>empty());
            }
            String now = Timestamps.now(clock);
            EntityRecord chosen = null;
            for (EntityRecord record : records) {
                if (record.hasId(id)) {
                    record.put(IS_DEFAULT, true).put(EntityRecord.UPDATED_AT, now);
                    chosen = record;
                } else if (record.isTrue(IS_DEFAULT)) {
                    record.put(IS_DEFAULT, false).put(EntityRecord.UPDATED_AT, now);
                }
            }
            log.info("Set default {} to {}", collectionName, id);
            return Mutation.changed(Optional.of(chosen.deepCopy()));
        });
    }

    @Override
    public Optional<EntityRecord> clearDefault(long id) {
        return modify(records -> {
            Optional<EntityRecord> target = records.stream().filter(r -> r.hasId(id)).findFirst();
            if (target.isEmpty()) {
                return Mutation.unchanged(Optional.<EntityRecord>empty());
            }
            EntityRecord record = target.get();
            if (!record.isTrue(IS_DEFAULT)) {
                return Mutation.unchanged(Optional.of(record.deepCopy()));
            }
            record.put(IS_DEFAULT, false).put(EntityRecord.UPDATED_AT, Timestamps.now(clock));
            log.info("Cleared default {} {}", collectionName, id);
            return Mutation.changed(Optional.of(record.deepCopy()));
        });
    }

    @Override
    public Optional<EntityRecord> getSmartDefault() {
        List<EntityRecord> records = load();
        Optional<EntityRecord> manual = records.stream().filter(r -> r.isTrue(IS_DEFAULT)).findFirst();
        if (manual.isPresent()) {
            return manual;
        }
        if (records.size() <= 1 || scorer == null) {
            return records.stream().min(UsageScorer.creationOrder());
        }
        return scorer.pickBest(records, clock.instant());
    }

    @Override
    protected void beforeStore(List<EntityRecord> records, EntityRecord stored) {
        if (!stored.isTrue(IS_DEFAULT)) {
            return;
        }
        String now = stored.getUpdatedAt();
        for (EntityRecord other : records) {
            if (!other.fieldEquals(EntityRecord.ID, stored.get(EntityRecord.ID)) && other.isTrue(IS_DEFAULT)) {
                other.put(IS_DEFAULT, false).put(EntityRecord.UPDATED_AT, now);
                log.info("Cleared default flag on {} {} in favour of {}", collectionName, other.getId(), stored.getId());
            }
        }
    }

    private Predicate<EntityRecord> inScope(EntityRecord input) {
        if (scopeField == null) {
            return r -> true;
        }
        Object scope = input.get(scopeField);
        return r -> scope == null ? r.get(scopeField) == null : r.fieldEquals(scopeField, scope);
    }

    private static Predicate<EntityRecord> nameMatches(String name) {
        String wanted = name == null ? null : name.trim().toLowerCase(Locale.ROOT);
        return r -> {
            String own = r.getString(NAME);
            return wanted != null && own != null && own.trim().toLowerCase(Locale.ROOT).equals(wanted);
        };
    }

    private static Predicate<EntityRecord> shortFormMatches(String shortForm) {
        return r -> Objects.equals(r.getString(SHORT_FORM), shortForm);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
