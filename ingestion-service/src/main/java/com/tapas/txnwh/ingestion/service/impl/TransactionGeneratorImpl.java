package com.tapas.txnwh.ingestion.service.impl;

import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.error.IntegrityViolationException;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.common.error.TransientStoreException;
import com.tapas.txnwh.common.partition.PartitionStore;
import com.tapas.txnwh.common.retry.RetryTemplates;
import com.tapas.txnwh.ingestion.config.IngestionProperties;
import com.tapas.txnwh.ingestion.service.GenerationReport;
import com.tapas.txnwh.ingestion.service.GenerationRequest;
import com.tapas.txnwh.ingestion.service.TransactionGenerator;
import com.tapas.txnwh.ingestion.source.TransactionSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class TransactionGeneratorImpl implements TransactionGenerator {

    private final TransactionSource source;
    private final PartitionStore<RawTransaction> rawStore;
    private final IngestionProperties properties;
    private final RetryTemplate writeRetry;

    public TransactionGeneratorImpl(TransactionSource source,
                                    PartitionStore<RawTransaction> rawStore,
                                    IngestionProperties properties) {
        this.source = source;
        this.rawStore = rawStore;
        this.properties = properties;
        this.writeRetry = RetryTemplates.fixedBackoff(
                "Raw partition write", properties.getRetry(), List.of(IOException.class));
    }

    @Override
    public GenerationReport generate(LocalDate date) {
        return generate(new GenerationRequest(
                date,
                properties.getRecordsPerDay(),
                properties.getChannels(),
                properties.getFailureRate()));
    }

    @Override
    public GenerationReport generate(GenerationRequest request) {
        validate(request);
        LocalDate date = request.date();
        long started = System.nanoTime();
        log.info("Starting ingestion | date={} count={} channels={} failureRate={}",
                date, request.count(), request.channels().size(), request.failureRate());

        List<RawTransaction> records;
        try {
            records = source.fetch(request);
        } catch (IOException e) {
            throw new TransientStoreException("Could not read transactions for " + date, e);
        }
        if (source.assignsIdentifiers()) {
            ensureUniqueIds(records, date);
        }

        // Publish with retry; the store leaves nothing behind on a failed attempt
        AtomicInteger attempts = new AtomicInteger();
        Path file;
        try {
            file = writeRetry.execute(context -> {
                attempts.set(context.getRetryCount() + 1);
                return rawStore.publish(date, records);
            });
        } catch (IOException e) {
            log.error("Ingestion failed after {} attempts | date={}", attempts.get(), date);
            throw new TransientStoreException(
                    "Raw partition for " + date + " not written after " + attempts.get() + " attempts", e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Ingestion successful | date={} records={} attempts={} durationMs={} file={}",
                date, records.size(), attempts.get(), elapsed.toMillis(), file);
        return new GenerationReport(date, records.size(), attempts.get(), file, elapsed);
    }

    private static void validate(GenerationRequest request) {
        if (request.date() == null) {
            throw new InvalidConfigurationException("Generation date is required");
        }
        if (request.count() <= 0) {
            throw new InvalidConfigurationException("Record count must be positive, got " + request.count());
        }
        if (request.channels() == null || request.channels().isEmpty()) {
            throw new InvalidConfigurationException("At least one channel is required");
        }
        if (request.failureRate() < 0.0 || request.failureRate() > 1.0) {
            throw new InvalidConfigurationException(
                    "Failure rate must be within [0, 1], got " + request.failureRate());
        }
    }

    /**
     * A repeated identifier means the id scheme is broken; retrying would reproduce it.
     */
    private static void ensureUniqueIds(List<RawTransaction> records, LocalDate date) {
        Set<String> seen = new HashSet<>(records.size() * 2);
        for (RawTransaction record : records) {
            if (!seen.add(record.transactionId())) {
                throw new IntegrityViolationException(
                        "Transaction id collision in generated partition " + date + ": " + record.transactionId());
            }
        }
    }
}
