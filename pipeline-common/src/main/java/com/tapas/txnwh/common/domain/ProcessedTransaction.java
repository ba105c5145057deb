package com.tapas.txnwh.common.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A validated, enriched transaction. Revenue is zero unless the status is SUCCESS.
 * Decimal fields carry the scales below, which are also the scales of the processed
 * partition columns, so a record read back from storage equals the one written.
 */
public record ProcessedTransaction(
        String transactionId,
        LocalDateTime timestamp,
        String customerId,
        String channel,
        String city,
        BigDecimal amount,
        TransactionStatus status,
        BigDecimal processingTime,
        BigDecimal feePercent,
        BigDecimal revenue,
        DelayBucket processingDelayBucket) {

    public static final int AMOUNT_SCALE = 2;
    public static final int PROCESSING_TIME_SCALE = 3;
    public static final int FEE_PERCENT_SCALE = 4;
}
