package com.kpisentinel.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Applies {@value #SCHEMA_RESOURCE} to a data source. Every statement is
 * idempotent, so the schema may be applied on each start.
 */
public final class SchemaInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    public static final String SCHEMA_RESOURCE = "db/schema.sql";

    private SchemaInitializer() {
        // utility class
    }

    public static void apply(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        LOG.info("Schema applied from {}", SCHEMA_RESOURCE);
    }
}
