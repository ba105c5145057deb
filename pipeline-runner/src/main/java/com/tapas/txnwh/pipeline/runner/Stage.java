package com.tapas.txnwh.pipeline.runner;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {
    INGEST("ingest"),
    TRANSFORM("transform"),
    LOAD("load");

    private final String code;

    Stage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<Stage> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.code.equals(normalized))
                .findFirst();
    }
}
