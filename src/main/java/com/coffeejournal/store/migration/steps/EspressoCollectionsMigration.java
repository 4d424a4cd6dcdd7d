package com.coffeejournal.store.migration.steps;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/** 1.3 to 1.4: espresso support. Creates the new collections empty; existing files are kept. */
@Slf4j
public class EspressoCollectionsMigration extends CollectionFileMigration {

    static final List<String> NEW_COLLECTIONS = List.of(
            "shots", "shot_sessions", "brewers", "portafilters", "baskets", "tampers", "wdt_tools", "leveling_tools");

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
        return "Add espresso support with shots, shot sessions and espresso equipment";
    }

    @Override
    public boolean requiresBackup() {
        return false;
    }

    @Override
    public void apply(Path dataDir) {
        for (String collection : NEW_COLLECTIONS) {
            if (exists(dataDir, collection)) {
                log.debug("{}.json already exists in {}", collection, dataDir);
                continue;
            }
            write(dataDir, collection, List.of());
            log.info("Created {}.json in {}", collection, dataDir);
        }
    }
}
