package com.tapas.txnwh.transformation.service.impl;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.error.DataQualityException;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.common.error.TransientStoreException;
import com.tapas.txnwh.common.partition.PartitionStore;
import com.tapas.txnwh.common.retry.RetryTemplates;
import com.tapas.txnwh.transformation.config.TransformationProperties;
import com.tapas.txnwh.transformation.service.CleaningResult;
import com.tapas.txnwh.transformation.service.TransactionCleaner;
import com.tapas.txnwh.transformation.service.TransformReport;
import com.tapas.txnwh.transformation.service.TransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class TransformationServiceImpl implements TransformationService {

    private static final Logger log = LoggerFactory.getLogger(TransformationServiceImpl.class);

    private final PartitionStore<RawTransaction> rawStore;
    private final PartitionStore<ProcessedTransaction> processedStore;
    private final TransactionCleaner cleaner;
    private final double maxDropRate;
    private final RetryTemplate writeRetry;

    public TransformationServiceImpl(PartitionStore<RawTransaction> rawStore,
                                     PartitionStore<ProcessedTransaction> processedStore,
                                     TransactionCleaner cleaner,
                                     TransformationProperties properties) {
        if (properties.getMaxDropRate() < 0.0 || properties.getMaxDropRate() > 1.0) {
            throw new InvalidConfigurationException(
                    "pipeline.transformation.max-drop-rate must be within [0, 1], got " + properties.getMaxDropRate());
        }
        this.rawStore = rawStore;
        this.processedStore = processedStore;
        this.cleaner = cleaner;
        this.maxDropRate = properties.getMaxDropRate();
        this.writeRetry = RetryTemplates.fixedBackoff(
                "Processed partition write", properties.getRetry(), List.of(IOException.class));
    }

    @Override
    public TransformReport transform(LocalDate date) {
        long started = System.nanoTime();

        List<RawTransaction> raw;
        try {
            raw = rawStore.read(date);
        } catch (IOException e) {
            throw new TransientStoreException("Could not read raw partition for " + date, e);
        }
        log.info("Starting transformation | date={} rawRecords={}", date, raw.size());

        CleaningResult result = cleaner.clean(raw);
        List<String> warnings = checkQuality(date, result);

        AtomicInteger attempts = new AtomicInteger();
        Path file;
        try {
            file = writeRetry.execute(context -> {
                attempts.set(context.getRetryCount() + 1);
                return processedStore.publish(date, result.records());
            });
        } catch (IOException e) {
            log.error("Transformation failed after {} attempts | date={}", attempts.get(), date);
            throw new TransientStoreException(
                    "Processed partition for " + date + " not written after " + attempts.get() + " attempts", e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Transformation successful | date={} input={} duplicates={} invalid={} unknownChannel={} "
                        + "output={} durationMs={}",
                date, result.inputCount(), result.duplicatesRemoved(), result.invalidDropped(),
                result.unknownChannelDropped(), result.records().size(), elapsed.toMillis());

        return new TransformReport(date,
                result.inputCount(),
                result.duplicatesRemoved(),
                result.invalidDropped(),
                result.unknownChannelDropped(),
                result.records().size(),
                warnings,
                attempts.get(),
                file,
                elapsed);
    }

    private List<String> checkQuality(LocalDate date, CleaningResult result) {
        if (result.records().isEmpty()) {
            throw new DataQualityException("No valid records left for " + date + " out of "
                    + result.inputCount() + " raw records");
        }
        if (result.dropRate() > maxDropRate) {
            throw new DataQualityException(String.format(
                    "Drop rate %.4f for %s exceeds the allowed %.4f (%d of %d records dropped)",
                    result.dropRate(), date, maxDropRate, result.droppedCount(),
                    result.inputCount() - result.duplicatesRemoved()));
        }

        List<String> warnings = new ArrayList<>();
        if (result.duplicatesRemoved() > 0) {
            warnings.add(result.duplicatesRemoved() + " duplicate transaction ids removed");
        }
        if (result.invalidDropped() > 0) {
            warnings.add(result.invalidDropped() + " invalid records dropped");
        }
        if (result.unknownChannelDropped() > 0) {
            warnings.add(result.unknownChannelDropped() + " records with unknown channel dropped");
        }
        warnings.forEach(w -> log.warn("Data quality | date={} {}", date, w));
        return List.copyOf(warnings);
    }
}
