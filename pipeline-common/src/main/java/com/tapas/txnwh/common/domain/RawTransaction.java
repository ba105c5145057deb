package com.tapas.txnwh.common.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of a raw partition, as generated or read back from CSV.
 * Status stays a plain string so that unknown values survive until validation.
 * Any field may be null when the source value was missing or unparseable.
 */
public record RawTransaction(
        String transactionId,
        LocalDateTime timestamp,
        String customerId,
        String channel,
        String city,
        BigDecimal amount,
        String status,
        BigDecimal processingTime) {
}
