package com.tapas.txnwh.ingestion.service;

import java.time.LocalDate;

public interface TransactionGenerator {

    /**
     * Generates the raw partition for {@code date} using the configured volume,
     * channels and failure rate.
     */
    GenerationReport generate(LocalDate date);

    GenerationReport generate(GenerationRequest request);
}
