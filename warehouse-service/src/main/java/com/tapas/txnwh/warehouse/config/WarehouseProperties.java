package com.tapas.txnwh.warehouse.config;

import com.tapas.txnwh.common.retry.RetrySettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties("pipeline.warehouse")
public class WarehouseProperties {

    /** Run {@code db/warehouse-schema.sql} (create-if-absent only) at startup. */
    private boolean initializeSchema = true;

    /** Attempts for a whole partition load on connection-level failures. */
    private RetrySettings retry = new RetrySettings();
}
