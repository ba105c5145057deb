package com.tapas.txnwh.ingestion.service;

import java.time.LocalDate;
import java.util.List;

public record GenerationRequest(
        LocalDate date,
        int count,
        List<String> channels,
        double failureRate) {
}
