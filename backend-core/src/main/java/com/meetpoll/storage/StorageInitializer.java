package com.meetpoll.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates tables, constraints and indexes when they are missing. Every statement is
 * {@code IF NOT EXISTS}, so running it against an initialized database changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageInitializer {

    static final String SCHEMA_LOCATION = "db/meetpoll-schema.sql";

    private final DataSource dataSource;
    private final StorageErrorTranslator translator;

    public void initializeStorage() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.setContinueOnError(false);
        try {
            DatabasePopulatorUtils.execute(populator, dataSource);
        } catch (RuntimeException e) {
            log.error("Storage initialization failed: {}", e.getMessage());
            throw translator.translate(e);
        }
        log.info("Storage schema is up to date");
    }
}
