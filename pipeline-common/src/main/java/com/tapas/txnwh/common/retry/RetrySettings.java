package com.tapas.txnwh.common.retry;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Attempt budget and fixed backoff for a stage's transient failures.
 * Bound from {@code pipeline.<stage>.retry.*}.
 */
@Getter
@Setter
public class RetrySettings {

    /** Total attempts, including the first one. */
    private int maxAttempts = 3;

    private Duration backoff = Duration.ofSeconds(2);

    public RetrySettings() {
    }

    public RetrySettings(int maxAttempts, Duration backoff) {
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public static RetrySettings immediate(int maxAttempts) {
        return new RetrySettings(maxAttempts, Duration.ZERO);
    }
}
