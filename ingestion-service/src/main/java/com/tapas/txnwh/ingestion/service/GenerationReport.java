package com.tapas.txnwh.ingestion.service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

public record GenerationReport(
        LocalDate date,
        int recordsGenerated,
        int writeAttempts,
        Path location,
        Duration elapsed) {
}
