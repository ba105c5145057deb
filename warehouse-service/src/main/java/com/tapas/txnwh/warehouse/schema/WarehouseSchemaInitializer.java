package com.tapas.txnwh.warehouse.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Makes sure the warehouse tables exist. Only {@code CREATE ... IF NOT EXISTS}; existing
 * tables are never altered.
 */
public class WarehouseSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(WarehouseSchemaInitializer.class);

    public static final String SCHEMA_SCRIPT = "db/warehouse-schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public WarehouseSchemaInitializer(DataSource dataSource, boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @Override
    public void afterPropertiesSet() {
        if (!enabled) {
            log.info("Warehouse schema initialization disabled");
            return;
        }
        initialize();
    }

    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.setContinueOnError(false);
        populator.execute(dataSource);
        log.info("Warehouse schema verified from {}", SCHEMA_SCRIPT);
    }
}
