package com.coffeejournal.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point. Startup brings every data directory up to the current schema
 * version before any repository is used.
 */
@SpringBootApplication
public class CoffeeJournalStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoffeeJournalStoreApplication.class, args);
    }
}
