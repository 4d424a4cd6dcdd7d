package com.coffeejournal.store.migration;

import com.coffeejournal.store.factory.RepositoryFactory;
import com.coffeejournal.store.migration.steps.DefaultMigrations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Migrates the default data directory and every tenant directory at startup, then makes
 * all repositories re-read from disk. A failed migration is logged and the application
 * keeps running on the old data version.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupMigrationRunner implements ApplicationRunner {

    private final RepositoryFactory factory;
    private final Clock clock;

    @Value("${store.schema.version.file:schema_version.json}")
    private String schemaVersionFilePath;

    @Value("${store.migrations.enabled:true}")
    private boolean enabled;

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Startup migrations are disabled");
            return;
        }
        migrateAll();
    }

    /** @return the data directories whose migration failed */
    public List<Path> migrateAll() {
        List<Path> failed = new ArrayList<>();
        List<String> tenants = new ArrayList<>();
        tenants.add(null);
        tenants.addAll(factory.listTenants());
        for (String tenant : tenants) {
            MigrationManager manager = managerFor(factory.getDataDir(tenant));
            try {
                if (manager.initializeIfFresh()) {
                    continue;
                }
                manager.runMigrations();
            } catch (RuntimeException e) {
                log.error("Migration failed for {}, data stays at version {}",
                        manager.getDataDir(), safeDataVersion(manager), e);
                failed.add(manager.getDataDir());
            }
        }
        factory.invalidateAllCaches(null);
        return failed;
    }

    public MigrationManager managerFor(Path dataDir) {
        return new MigrationManager(dataDir, Paths.get(schemaVersionFilePath), DefaultMigrations.all(clock), clock);
    }

    private static String safeDataVersion(MigrationManager manager) {
        try {
            return manager.getDataVersion();
        } catch (RuntimeException e) {
            return "unknown";
        }
    }
}
