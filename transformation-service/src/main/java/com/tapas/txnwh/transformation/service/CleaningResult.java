package com.tapas.txnwh.transformation.service;

import com.tapas.txnwh.common.domain.ProcessedTransaction;

import java.util.List;

public record CleaningResult(
        List<ProcessedTransaction> records,
        int inputCount,
        int duplicatesRemoved,
        int invalidDropped,
        int unknownChannelDropped) {

    public int droppedCount() {
        return invalidDropped + unknownChannelDropped;
    }

    /**
     * Dropped records as a fraction of the deduplicated input.
     */
    public double dropRate() {
        int candidates = inputCount - duplicatesRemoved;
        return candidates == 0 ? 0.0 : (double) droppedCount() / candidates;
    }
}
