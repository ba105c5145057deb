package com.tapas.txnwh.pipeline.runner;

import com.tapas.txnwh.common.error.ErrorKind;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one stage. {@code errorKind} is set only for {@link StageStatus#FAILED}.
 */
public record StageResult(
        Stage stage,
        StageStatus status,
        String detail,
        List<String> warnings,
        ErrorKind errorKind,
        Duration elapsed) {

    public static StageResult completed(Stage stage, String detail, List<String> warnings, Duration elapsed) {
        StageStatus status = warnings.isEmpty() ? StageStatus.SUCCEEDED : StageStatus.SUCCEEDED_WITH_WARNINGS;
        return new StageResult(stage, status, detail, List.copyOf(warnings), null, elapsed);
    }

    public static StageResult skipped(Stage stage, String reason) {
        return new StageResult(stage, StageStatus.SKIPPED, reason, List.of(), null, Duration.ZERO);
    }

    public static StageResult failed(Stage stage, ErrorKind kind, String message, Duration elapsed) {
        return new StageResult(stage, StageStatus.FAILED, message, List.of(), kind, elapsed);
    }

    public static StageResult aborted(Stage stage) {
        return new StageResult(stage, StageStatus.ABORTED, "run interrupted", List.of(), null, Duration.ZERO);
    }
}
