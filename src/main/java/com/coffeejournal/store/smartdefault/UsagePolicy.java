package com.coffeejournal.store.smartdefault;

import com.coffeejournal.store.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * How usage of a lookup record is measured: which collections reference it, and how
 * frequency and recency are weighted against each other.
 *
 * @param sources         collections and reference fields that count as a use
 * @param frequencyWeight weight of the raw reference count
 * @param recencyWeight   weight of the decayed recency of the latest use
 * @param horizonDays     days after which a use no longer counts as recent
 */
public record UsagePolicy(List<UsageSource> sources, double frequencyWeight, double recencyWeight, int horizonDays) {

    /** One collection whose records point at the lookup through {@code field}. */
    public record UsageSource(String collectionName, String field) {
    }

    private static final int EQUIPMENT_HORIZON_DAYS = 7;
    private static final int ROASTER_HORIZON_DAYS = 30;

    public UsagePolicy {
        sources = List.copyOf(sources);
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("horizonDays must be positive");
        }
    }

    /** @return the built-in policy for a lookup type, or empty when it is not usage-ranked */
    public static Optional<UsagePolicy> forType(EntityType type) {
        return switch (type) {
            case BREW_METHODS -> Optional.of(equipment("brew_sessions", "brew_method_id"));
            case RECIPES -> Optional.of(equipment("brew_sessions", "recipe_id"));
            case GRINDERS -> Optional.of(new UsagePolicy(List.of(
                    new UsageSource("brew_sessions", "grinder_id"),
                    new UsageSource("shots", "grinder_id")), 0.6, 0.4, EQUIPMENT_HORIZON_DAYS));
            case FILTERS -> Optional.of(equipment("brew_sessions", "filter_id"));
            case KETTLES -> Optional.of(equipment("brew_sessions", "kettle_id"));
            case SCALES -> Optional.of(new UsagePolicy(List.of(
                    new UsageSource("brew_sessions", "scale_id"),
                    new UsageSource("shots", "scale_id")), 0.6, 0.4, EQUIPMENT_HORIZON_DAYS));
            case BREWERS -> Optional.of(new UsagePolicy(List.of(
                    new UsageSource("brew_sessions", "brewer_id"),
                    new UsageSource("shots", "brewer_id")), 0.6, 0.4, EQUIPMENT_HORIZON_DAYS));
            case PORTAFILTERS -> Optional.of(equipment("shots", "portafilter_id"));
            case BASKETS -> Optional.of(equipment("shots", "basket_id"));
            case TAMPERS -> Optional.of(equipment("shots", "tamper_id"));
            case WDT_TOOLS -> Optional.of(equipment("shots", "wdt_tool_id"));
            case LEVELING_TOOLS -> Optional.of(equipment("shots", "leveling_tool_id"));
            case ROASTERS -> Optional.of(new UsagePolicy(
                    List.of(new UsageSource("products", "roaster_id")), 0.7, 0.3, ROASTER_HORIZON_DAYS));
            default -> Optional.empty();
        };
    }

    private static UsagePolicy equipment(String collectionName, String field) {
        return new UsagePolicy(List.of(new UsageSource(collectionName, field)), 0.6, 0.4, EQUIPMENT_HORIZON_DAYS);
    }
}
