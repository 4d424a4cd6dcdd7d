package com.coffeejournal.store.smartdefault;

import com.coffeejournal.store.model.EntityRecord;
import com.coffeejournal.store.repository.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ranks lookup records by {@code frequencyWeight * uses + recencyWeight * recency}, where
 * recency decays linearly from 1 (used today) to 0 at the policy horizon.
 */
@Slf4j
public class UsageScorer {

    private final UsagePolicy policy;
    private final Function<String, List<EntityRecord>> usageLoader;

    /**
     * @param usageLoader returns the current records of a source collection by name
     */
    public UsageScorer(UsagePolicy policy, Function<String, List<EntityRecord>> usageLoader) {
        this.policy = policy;
        this.usageLoader = usageLoader;
    }

    /** Usage statistics of one candidate. */
    public record Usage(long count, Instant lastUsed) {
    }

    /**
     * @return the highest-scoring candidate; ties go to the earliest-created one
     */
    public Optional<EntityRecord> pickBest(List<EntityRecord> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        List<List<EntityRecord>> sources = policy.sources().stream()
                .map(source -> usageLoader.apply(source.collectionName()))
                .toList();

        EntityRecord best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (EntityRecord candidate : candidates.stream().sorted(creationOrder()).toList()) {
            Long id = candidate.getId();
            if (id == null) {
                continue;
            }
            double score = score(usageOf(id, sources), now);
            log.debug("Smart default candidate {} scored {}", id, score);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public double score(Usage usage, Instant now) {
        return policy.frequencyWeight() * usage.count() + policy.recencyWeight() * recency(usage.lastUsed(), now);
    }

    double recency(Instant lastUsed, Instant now) {
        if (lastUsed == null) {
            return 0.0;
        }
        long days = Math.max(0, Duration.between(lastUsed, now).toDays());
        return Math.max(0.0, 1.0 - (double) days / policy.horizonDays());
    }

    private Usage usageOf(long id, List<List<EntityRecord>> sources) {
        long count = 0;
        Instant latest = null;
        for (int i = 0; i < sources.size(); i++) {
            String field = policy.sources().get(i).field();
            for (EntityRecord use : sources.get(i)) {
                if (!use.references(field, id)) {
                    continue;
                }
                count++;
                Instant when = usedAt(use).orElse(null);
                if (when != null && (latest == null || when.isAfter(latest))) {
                    latest = when;
                }
            }
        }
        return new Usage(count, latest);
    }

    private static Optional<Instant> usedAt(EntityRecord use) {
        Optional<Instant> created = Timestamps.parse(use.getCreatedAt());
        return created.isPresent() ? created : Timestamps.parse(use.getString("timestamp"));
    }

    /** Earliest {@code created_at} first, then lowest id; records without a timestamp sort last. */
    public static Comparator<EntityRecord> creationOrder() {
        return Comparator.<EntityRecord, Instant>comparing(r -> Timestamps.parse(r.getCreatedAt()).orElse(Instant.MAX))
                .thenComparing(r -> r.getId() == null ? Long.MAX_VALUE : r.getId());
    }
}
