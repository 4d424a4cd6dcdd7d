package com.coffeejournal.store.migration.steps;

import com.coffeejournal.store.migration.Migration;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/** 1.4 to 1.5: score ranges and shot equipment fields changed in the schemas only. */
@Slf4j
public class ValidationRulesMigration implements Migration {

    @Override
    public String fromVersion() {
        return "1.4";
    }

    @Override
    public String toVersion() {
        return "1.5";
    }

    @Override
    public String description() {
        return "Update validation rules for scores and add shot equipment fields";
    }

    @Override
    public boolean requiresBackup() {
        return false;
    }

    @Override
    public void apply(Path dataDir) {
        log.debug("No data changes needed in {}", dataDir);
    }
}
