package com.tapas.txnwh.transformation.service;

import com.tapas.txnwh.common.domain.DelayBucket;
import com.tapas.txnwh.common.error.InvalidConfigurationException;

import java.math.BigDecimal;

/**
 * {@code fast} below {@code fastBelow}, {@code slow} from {@code slowFrom}, {@code medium} in between.
 */
public record DelayThresholds(BigDecimal fastBelow, BigDecimal slowFrom) {

    public DelayThresholds {
        if (fastBelow == null || slowFrom == null
                || fastBelow.signum() <= 0 || fastBelow.compareTo(slowFrom) >= 0) {
            throw new InvalidConfigurationException(
                    "Delay thresholds must satisfy 0 < fast < slow, got fast=" + fastBelow + " slow=" + slowFrom);
        }
    }

    public DelayBucket bucketFor(BigDecimal processingSeconds) {
        if (processingSeconds.compareTo(fastBelow) < 0) {
            return DelayBucket.FAST;
        }
        if (processingSeconds.compareTo(slowFrom) < 0) {
            return DelayBucket.MEDIUM;
        }
        return DelayBucket.SLOW;
    }
}
