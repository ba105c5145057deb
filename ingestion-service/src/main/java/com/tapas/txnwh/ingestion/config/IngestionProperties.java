package com.tapas.txnwh.ingestion.config;

import com.tapas.txnwh.common.retry.RetrySettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties("pipeline.ingestion")
public class IngestionProperties {

    public enum SourceType {
        SYNTHETIC,
        EXTERNAL
    }

    private SourceType source = SourceType.SYNTHETIC;

    private int recordsPerDay = 500;

    /** Probability that a synthetic transaction has status {@code failed}. */
    private double failureRate = 0.1;

    private List<String> channels = new ArrayList<>(List.of(
            "Credit Card", "Debit Card", "UPI", "Net Banking"));

    private List<String> cities = new ArrayList<>(List.of(
            "Mumbai", "Delhi", "Bengaluru", "Chennai", "Hyderabad", "Pune", "Kolkata"));

    private int customerPoolSize = 1000;

    /** Combined with the partition date, so each date regenerates identically. */
    private long seed = 42L;

    /** Where the external source expects {@code YYYY-MM-DD.csv} drops. */
    private Path inboxDir = Path.of("data", "inbox");

    private RetrySettings retry = new RetrySettings();
}
