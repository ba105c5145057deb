package com.tapas.txnwh.common.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of a transaction. PENDING is never produced by the synthetic
 * generator but is accepted from external sources.
 */
public enum TransactionStatus {
    SUCCESS("success"),
    FAILED("failed"),
    PENDING("pending");

    private final String code;

    TransactionStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<TransactionStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(s -> s.code.equals(trimmed))
                .findFirst();
    }
}
