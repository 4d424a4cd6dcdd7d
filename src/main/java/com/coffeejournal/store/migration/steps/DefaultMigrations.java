package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.migration.Migration;

import java.time.Clock;
import java.util.List;

/** The built-in migration steps, oldest first. */
public final class DefaultMigrations {

    private DefaultMigrations() {
    }

    public static List<Migration> all(Clock clock) {
        return List.of(
                new RegionsTableMigration(clock),
                new EspressoCollectionsMigration(),
                new ValidationRulesMigration(),
                new BeanProcessArrayMigration());
    }
}
