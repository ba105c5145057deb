package com.tapas.txnwh.transformation.service;

import java.time.LocalDate;

public interface TransformationService {

    /**
     * Cleans the complete raw partition for {@code date} and publishes the processed partition.
     */
    TransformReport transform(LocalDate date);
}
