package com.tapas.txnwh.warehouse.service;

import java.time.LocalDate;
import java.util.List;

public record LoadResult(
        LocalDate partitionDate,
        int factsWritten,
        int dimsUpserted,
        int attempts,
        List<String> warnings) {
}
