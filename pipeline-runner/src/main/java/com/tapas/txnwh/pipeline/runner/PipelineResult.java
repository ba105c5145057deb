package com.tapas.txnwh.pipeline.runner;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public record PipelineResult(LocalDate date, List<StageResult> stages) {

    /**
     * Stages that ran to completion in this run, with or without warnings. Skipped stages
     * are not included.
     */
    public List<Stage> stagesCompleted() {
        return stages.stream()
                .filter(r -> r.status() == StageStatus.SUCCEEDED || r.status() == StageStatus.SUCCEEDED_WITH_WARNINGS)
                .map(StageResult::stage)
                .toList();
    }

    public Optional<StageResult> failure() {
        return stages.stream()
                .filter(r -> r.status().isFailure())
                .findFirst();
    }

    public boolean isSuccess() {
        return failure().isEmpty();
    }

    public Optional<StageResult> resultFor(Stage stage) {
        return stages.stream()
                .filter(r -> r.stage() == stage)
                .findFirst();
    }
}
