package com.coffeejournal.store.factory;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StoreConfiguration {

    /** Source of every stored timestamp. */
    @Bean
    public Clock storeClock() {
        return Clock.systemUTC();
    }
}
