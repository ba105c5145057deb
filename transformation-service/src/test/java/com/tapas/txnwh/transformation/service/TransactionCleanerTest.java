package com.tapas.txnwh.transformation.service;

import com.tapas.txnwh.common.domain.DelayBucket;
import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.domain.TransactionStatus;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionCleanerTest {

    private final TransactionCleaner cleaner = new TransactionCleaner(
            new ChannelFeeTable(Map.of(
                    "Credit Card", new BigDecimal("2.5"),
                    "Debit Card", new BigDecimal("1.0"),
                    "UPI", new BigDecimal("0.5"),
                    "Net Banking", new BigDecimal("1.5"))),
            new DelayThresholds(new BigDecimal("2"), new BigDecimal("5")));

    @Test
    void duplicatesAreRemovedKeepingFirstOccurrence() {
        List<RawTransaction> raw = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            raw.add(raw("TXN-" + i, "100.00", "success", "1.0"));
        }
        raw.add(raw("TXN-3", "555.00", "failed", "1.0"));
        raw.add(raw("TXN-7", "555.00", "failed", "1.0"));
        raw.add(raw("TXN-7", "555.00", "failed", "1.0"));

        CleaningResult result = cleaner.clean(raw);

        assertThat(result.inputCount()).isEqualTo(13);
        assertThat(result.duplicatesRemoved()).isEqualTo(3);
        assertThat(result.records()).hasSize(10);
        assertThat(result.records()).extracting(ProcessedTransaction::transactionId).doesNotHaveDuplicates();
        assertThat(result.records())
                .filteredOn(t -> t.transactionId().equals("TXN-3"))
                .singleElement()
                .satisfies(t -> assertThat(t.amount()).isEqualByComparingTo("100.00"));
    }

    @Test
    void invalidRecordsAreDroppedAndOthersPassThrough() {
        List<RawTransaction> raw = List.of(
                raw("TXN-ZERO", "0", "success", "1.0"),
                raw("TXN-NEG", "-5.00", "success", "1.0"),
                raw("TXN-BOGUS", "10.00", "bogus", "1.0"),
                raw("", "10.00", "success", "1.0"),
                raw("TXN-OK-1", "10.00", "success", "1.0"),
                raw("TXN-OK-2", "20.00", "failed", "1.0"));

        CleaningResult result = cleaner.clean(raw);

        assertThat(result.invalidDropped()).isEqualTo(4);
        assertThat(result.records()).extracting(ProcessedTransaction::transactionId)
                .containsExactly("TXN-OK-1", "TXN-OK-2");
    }

    @Test
    void missingRequiredFieldsAreInvalid() {
        assertThat(TransactionCleaner.isValid(raw("TXN-1", "10.00", "success", "1.0"))).isTrue();
        assertThat(TransactionCleaner.isValid(new RawTransaction("TXN-1", null, "CUST-000001", "UPI", "Pune",
                new BigDecimal("10.00"), "success", new BigDecimal("1.0")))).isFalse();
        assertThat(TransactionCleaner.isValid(new RawTransaction("TXN-1", LocalDateTime.of(2024, 1, 15, 9, 0),
                "CUST-000001", "UPI", "Pune", null, "success", new BigDecimal("1.0")))).isFalse();
        assertThat(TransactionCleaner.isValid(raw("TXN-1", "10.00", "SUCCESS", "1.0"))).isFalse();
        assertThat(TransactionCleaner.isValid(raw("TXN-1", "10.00", "success", "-0.1"))).isFalse();
    }

    @Test
    void revenueIsFeeShareOfSuccessfulPaymentsOnly() {
        CleaningResult result = cleaner.clean(List.of(
                raw("TXN-S", "100.00", "success", "1.0"),
                raw("TXN-F", "100.00", "failed", "1.0"),
                raw("TXN-P", "100.00", "pending", "1.0")));

        assertThat(result.records()).extracting(t -> t.revenue().toPlainString())
                .containsExactly("2.50", "0.00", "0.00");
        assertThat(result.records().get(0).feePercent()).isEqualByComparingTo("2.5");
        assertThat(result.records()).extracting(ProcessedTransaction::status)
                .containsExactly(TransactionStatus.SUCCESS, TransactionStatus.FAILED, TransactionStatus.PENDING);
    }

    @Test
    void revenueRoundsHalfUpToCents() {
        assertThat(TransactionCleaner.revenue(new BigDecimal("10.10"), TransactionStatus.SUCCESS, new BigDecimal("0.5")))
                .isEqualTo(new BigDecimal("0.05"));
        assertThat(TransactionCleaner.revenue(new BigDecimal("33.33"), TransactionStatus.SUCCESS, new BigDecimal("1.5")))
                .isEqualTo(new BigDecimal("0.50"));
    }

    @Test
    void processingTimeIsBucketed() {
        CleaningResult result = cleaner.clean(List.of(
                raw("TXN-1", "10.00", "success", "1.5"),
                raw("TXN-2", "10.00", "success", "3.0"),
                raw("TXN-3", "10.00", "success", "6.0"),
                raw("TXN-4", "10.00", "success", "1.999"),
                raw("TXN-5", "10.00", "success", "2"),
                raw("TXN-6", "10.00", "success", "4.999"),
                raw("TXN-7", "10.00", "success", "5")));

        assertThat(result.records()).extracting(ProcessedTransaction::processingDelayBucket).containsExactly(
                DelayBucket.FAST, DelayBucket.MEDIUM, DelayBucket.SLOW,
                DelayBucket.FAST, DelayBucket.MEDIUM, DelayBucket.MEDIUM, DelayBucket.SLOW);
    }

    @Test
    void valuesAreRoundedToStoredScaleBeforeDerivation() {
        CleaningResult result = cleaner.clean(List.of(
                raw("TXN-1", "10.005", "success", "1.9995"),
                raw("TXN-2", "99.994", "success", "4.9996")));

        ProcessedTransaction first = result.records().get(0);
        assertThat(first.amount()).isEqualTo(new BigDecimal("10.01"));
        assertThat(first.processingTime()).isEqualTo(new BigDecimal("2.000"));
        assertThat(first.processingDelayBucket()).isEqualTo(DelayBucket.MEDIUM);
        assertThat(first.revenue()).isEqualTo(TransactionCleaner.revenue(
                new BigDecimal("10.01"), TransactionStatus.SUCCESS, new BigDecimal("2.5")));
        assertThat(first.feePercent()).isEqualTo(new BigDecimal("2.5000"));

        ProcessedTransaction second = result.records().get(1);
        assertThat(second.amount()).isEqualTo(new BigDecimal("99.99"));
        assertThat(second.processingTime()).isEqualTo(new BigDecimal("5.000"));
        assertThat(second.processingDelayBucket()).isEqualTo(DelayBucket.SLOW);
    }

    @Test
    void amountRoundingToZeroIsInvalid() {
        CleaningResult result = cleaner.clean(List.of(
                raw("TXN-TINY", "0.004", "success", "1.0"),
                raw("TXN-CENT", "0.005", "success", "1.0")));

        assertThat(result.invalidDropped()).isEqualTo(1);
        assertThat(result.records()).singleElement().satisfies(t -> {
            assertThat(t.transactionId()).isEqualTo("TXN-CENT");
            assertThat(t.amount()).isEqualTo(new BigDecimal("0.01"));
        });
    }

    @Test
    void unknownChannelsAreDroppedDuringEnrichment() {
        RawTransaction crypto = new RawTransaction("TXN-X", LocalDateTime.of(2024, 1, 15, 9, 0), "CUST-000001",
                "Crypto", "Pune", new BigDecimal("10.00"), "success", new BigDecimal("1.0"));

        CleaningResult result = cleaner.clean(List.of(crypto, raw("TXN-1", "10.00", "success", "1.0")));

        assertThat(result.unknownChannelDropped()).isEqualTo(1);
        assertThat(result.droppedCount()).isEqualTo(1);
        assertThat(result.dropRate()).isEqualTo(0.5);
        assertThat(result.records()).extracting(ProcessedTransaction::transactionId).containsExactly("TXN-1");
    }

    @Test
    void cleaningIsDeterministic() {
        List<RawTransaction> raw = List.of(
                raw("TXN-2", "10.00", "success", "1.0"),
                raw("TXN-1", "20.00", "failed", "6.0"),
                raw("TXN-2", "10.00", "success", "1.0"));

        assertThat(cleaner.clean(raw)).isEqualTo(cleaner.clean(raw));
    }

    @Test
    void invalidReferenceDataIsRejected() {
        assertThatThrownBy(() -> new ChannelFeeTable(Map.of()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new ChannelFeeTable(Map.of("UPI", new BigDecimal("-1"))))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new DelayThresholds(new BigDecimal("5"), new BigDecimal("2")))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    private static RawTransaction raw(String id, String amount, String status, String processingTime) {
        return new RawTransaction(id, LocalDateTime.of(2024, 1, 15, 9, 0), "CUST-000001", "Credit Card", "Mumbai",
                new BigDecimal(amount), status, new BigDecimal(processingTime));
    }
}
