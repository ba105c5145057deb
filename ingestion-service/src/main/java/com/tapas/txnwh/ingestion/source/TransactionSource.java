package com.tapas.txnwh.ingestion.source;

import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.ingestion.service.GenerationRequest;

import java.io.IOException;
import java.util.List;

/**
 * Supplies one day's raw transactions.
 */
public interface TransactionSource {

    List<RawTransaction> fetch(GenerationRequest request) throws IOException;

    /**
     * Whether this source mints the transaction ids itself. Only then is a repeated id a
     * defect of the run; duplicates in external extracts are removed by the cleaner.
     */
    default boolean assignsIdentifiers() {
        return true;
    }
}
