package com.tapas.txnwh.pipeline.runner;

public enum StageStatus {
    SUCCEEDED,
    SUCCEEDED_WITH_WARNINGS,
    SKIPPED,
    FAILED,
    ABORTED;

    public boolean isFailure() {
        return this == FAILED || this == ABORTED;
    }
}
