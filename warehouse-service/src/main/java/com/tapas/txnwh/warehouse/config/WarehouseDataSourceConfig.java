package com.tapas.txnwh.warehouse.config;

import com.tapas.txnwh.warehouse.schema.WarehouseSchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Warehouse connection pool. Bound from {@code pipeline.warehouse.datasource} and marked
 * {@code @Primary} so Spring Boot's JDBC support uses it.
 */
@Configuration
@EnableConfigurationProperties(WarehouseProperties.class)
public class WarehouseDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseDataSourceConfig.class);

    @Bean
    @Primary
    @ConfigurationProperties("pipeline.warehouse.datasource")
    public DataSourceProperties warehouseDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource warehouseDataSource() {
        DataSourceProperties properties = warehouseDataSourceProperties();
        log.info("Creating warehouse DataSource with URL: {}", properties.getUrl());
        return properties
                .initializeDataSourceBuilder()
                .build();
    }

    @Bean
    @Primary
    public JdbcTemplate warehouseJdbcTemplate() {
        return new JdbcTemplate(warehouseDataSource());
    }

    @Bean
    @Primary
    public PlatformTransactionManager warehouseTransactionManager() {
        return new DataSourceTransactionManager(warehouseDataSource());
    }

    @Bean
    public WarehouseSchemaInitializer warehouseSchemaInitializer(WarehouseProperties properties) {
        return new WarehouseSchemaInitializer(warehouseDataSource(), properties.isInitializeSchema());
    }
}
