package com.tapas.txnwh.pipeline.runner;

import java.util.EnumSet;
import java.util.Set;

/**
 * @param stages stages to run; execution order is always {@link Stage} declaration order
 * @param force  re-run stages even when their output is already complete
 */
public record RunOptions(Set<Stage> stages, boolean force) {

    public RunOptions {
        stages = Set.copyOf(stages);
    }

    public static RunOptions defaults() {
        return new RunOptions(EnumSet.allOf(Stage.class), false);
    }

    public boolean includes(Stage stage) {
        return stages.contains(stage);
    }

    public RunOptions withForce(boolean force) {
        return new RunOptions(stages, force);
    }
}
