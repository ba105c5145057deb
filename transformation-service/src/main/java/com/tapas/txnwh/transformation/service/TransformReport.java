package com.tapas.txnwh.transformation.service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

public record TransformReport(
        LocalDate date,
        int inputRecords,
        int duplicatesRemoved,
        int invalidDropped,
        int unknownChannelDropped,
        int outputRecords,
        List<String> warnings,
        int writeAttempts,
        Path location,
        Duration elapsed) {

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
