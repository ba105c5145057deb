package com.tapas.txnwh.transformation.config;

import com.tapas.txnwh.common.retry.RetrySettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties("pipeline.transformation")
public class TransformationProperties {

    /** Channel name to fee percent. A channel missing here cannot be enriched. */
    private Map<String, BigDecimal> channelFees = new LinkedHashMap<>(Map.of(
            "Credit Card", new BigDecimal("2.5"),
            "Debit Card", new BigDecimal("1.0"),
            "UPI", new BigDecimal("0.5"),
            "Net Banking", new BigDecimal("1.5")));

    /** Processing times below this are {@code fast}. */
    private BigDecimal fastThresholdSeconds = new BigDecimal("2");

    /** Processing times at or above this are {@code slow}; in between is {@code medium}. */
    private BigDecimal slowThresholdSeconds = new BigDecimal("5");

    /**
     * Fraction of (deduplicated) records that may be dropped before the stage fails.
     * 1.0 means drops alone never fail it; it still fails when nothing survives.
     */
    private double maxDropRate = 1.0;

    private RetrySettings retry = new RetrySettings();
}
