package com.tapas.txnwh.common.domain;

import java.util.Arrays;

public enum DelayBucket {
    FAST("fast"),
    MEDIUM("medium"),
    SLOW("slow");

    private final String code;

    DelayBucket(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static DelayBucket fromCode(String code) {
        return Arrays.stream(values())
                .filter(b -> b.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown delay bucket: " + code));
    }
}
