package com.tapas.txnwh.warehouse.service;

import com.tapas.txnwh.common.domain.ProcessedTransaction;

import java.time.LocalDate;
import java.util.List;

public interface WarehouseLoader {

    /**
     * Loads the complete processed partition for {@code date}.
     */
    LoadResult load(LocalDate date);

    /**
     * Upserts {@code records} as the partition for {@code date} in a single transaction.
     * Loading the same records again leaves the warehouse unchanged.
     */
    LoadResult load(LocalDate date, List<ProcessedTransaction> records);

    boolean isLoaded(LocalDate date);
}
