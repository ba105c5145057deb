package com.tapas.txnwh.transformation.service;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.domain.TransactionStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cleans one raw partition in memory: deduplicate, validate, enrich, derive.
 * Every step is a pure function of its input, so the same raw partition always
 * produces the same processed partition.
 */
public class TransactionCleaner {

    private static final BigDecimal ZERO_REVENUE = BigDecimal.ZERO.setScale(ProcessedTransaction.AMOUNT_SCALE);

    private final ChannelFeeTable feeTable;
    private final DelayThresholds thresholds;

    public TransactionCleaner(ChannelFeeTable feeTable, DelayThresholds thresholds) {
        this.feeTable = feeTable;
        this.thresholds = thresholds;
    }

    public CleaningResult clean(List<RawTransaction> raw) {
        List<RawTransaction> unique = deduplicate(raw);
        List<RawTransaction> valid = validate(unique);
        List<ProcessedTransaction> enriched = enrich(valid);

        return new CleaningResult(
                enriched,
                raw.size(),
                raw.size() - unique.size(),
                unique.size() - valid.size(),
                valid.size() - enriched.size());
    }

    /**
     * Keeps the first occurrence of each transaction id. Records without an id are kept
     * here and dropped by {@link #validate}.
     */
    public List<RawTransaction> deduplicate(List<RawTransaction> records) {
        Set<String> seen = new HashSet<>();
        List<RawTransaction> unique = new ArrayList<>(records.size());
        for (RawTransaction record : records) {
            if (isBlank(record.transactionId()) || seen.add(record.transactionId())) {
                unique.add(record);
            }
        }
        return unique;
    }

    /**
     * Drops invalid records and rounds amount and processing time to their stored scale.
     * Rules are checked again after rounding, so an amount that rounds to zero is dropped.
     */
    public List<RawTransaction> validate(List<RawTransaction> records) {
        return records.stream()
                .filter(TransactionCleaner::isValid)
                .map(TransactionCleaner::normalize)
                .filter(TransactionCleaner::isValid)
                .toList();
    }

    static RawTransaction normalize(RawTransaction record) {
        return new RawTransaction(
                record.transactionId(),
                record.timestamp(),
                record.customerId(),
                record.channel(),
                record.city(),
                record.amount().setScale(ProcessedTransaction.AMOUNT_SCALE, RoundingMode.HALF_UP),
                record.status(),
                record.processingTime().setScale(ProcessedTransaction.PROCESSING_TIME_SCALE, RoundingMode.HALF_UP));
    }

    /**
     * Joins the channel fee table and derives revenue and delay bucket. Records whose
     * channel has no fee entry are dropped.
     */
    public List<ProcessedTransaction> enrich(List<RawTransaction> records) {
        List<ProcessedTransaction> enriched = new ArrayList<>(records.size());
        for (RawTransaction record : records) {
            Optional<BigDecimal> fee = feeTable.feePercent(record.channel());
            if (fee.isEmpty()) {
                continue;
            }
            TransactionStatus status = TransactionStatus.fromCode(record.status()).orElseThrow();
            enriched.add(new ProcessedTransaction(
                    record.transactionId(),
                    record.timestamp(),
                    record.customerId(),
                    record.channel(),
                    record.city(),
                    record.amount(),
                    status,
                    record.processingTime(),
                    fee.get(),
                    revenue(record.amount(), status, fee.get()),
                    thresholds.bucketFor(record.processingTime())));
        }
        return enriched;
    }

    /**
     * {@code amount * feePercent / 100} rounded half-up to cents; zero unless the payment succeeded.
     */
    public static BigDecimal revenue(BigDecimal amount, TransactionStatus status, BigDecimal feePercent) {
        if (status != TransactionStatus.SUCCESS) {
            return ZERO_REVENUE;
        }
        return amount.multiply(feePercent).movePointLeft(2).setScale(ProcessedTransaction.AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    static boolean isValid(RawTransaction record) {
        return !isBlank(record.transactionId())
                && record.amount() != null && record.amount().signum() > 0
                && TransactionStatus.fromCode(record.status()).isPresent()
                && record.timestamp() != null
                && !isBlank(record.customerId())
                && !isBlank(record.city())
                && record.processingTime() != null && record.processingTime().signum() >= 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
