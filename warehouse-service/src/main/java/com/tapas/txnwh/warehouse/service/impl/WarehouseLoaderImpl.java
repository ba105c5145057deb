package com.tapas.txnwh.warehouse.service.impl;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.error.ErrorClassifier;
import com.tapas.txnwh.common.error.ErrorKind;
import com.tapas.txnwh.common.error.IntegrityViolationException;
import com.tapas.txnwh.common.error.TransientStoreException;
import com.tapas.txnwh.common.partition.PartitionStore;
import com.tapas.txnwh.common.retry.RetryTemplates;
import com.tapas.txnwh.warehouse.config.WarehouseProperties;
import com.tapas.txnwh.warehouse.repository.ChannelRow;
import com.tapas.txnwh.warehouse.repository.CustomerRow;
import com.tapas.txnwh.warehouse.repository.DateRow;
import com.tapas.txnwh.warehouse.repository.WarehouseRepository;
import com.tapas.txnwh.warehouse.service.CustomerProfiles;
import com.tapas.txnwh.warehouse.service.LoadResult;
import com.tapas.txnwh.warehouse.service.WarehouseLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

@Service
@Slf4j
public class WarehouseLoaderImpl implements WarehouseLoader {

    /**
     * Connection-level failures, plus a duplicate dimension key: another date's load inserted
     * the same natural key first, and the retried merge will match it.
     */
    static final List<Class<? extends Throwable>> RETRY_ON = Stream.<Class<? extends Throwable>>concat(
            ErrorClassifier.TRANSIENT_DATA_ACCESS.stream(),
            Stream.of(DuplicateKeyException.class)).toList();

    private static final int MAX_REPORTED_IDS = 10;

    private final PartitionStore<ProcessedTransaction> processedStore;
    private final WarehouseRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate loadRetry;

    public WarehouseLoaderImpl(PartitionStore<ProcessedTransaction> processedStore,
                               WarehouseRepository repository,
                               PlatformTransactionManager transactionManager,
                               WarehouseProperties properties) {
        this.processedStore = processedStore;
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.loadRetry = RetryTemplates.fixedBackoff("Warehouse load", properties.getRetry(), RETRY_ON);
    }

    @Override
    public LoadResult load(LocalDate date) {
        List<ProcessedTransaction> records;
        try {
            records = processedStore.read(date);
        } catch (IOException e) {
            throw new TransientStoreException("Could not read processed partition for " + date, e);
        }
        return load(date, records);
    }

    @Override
    public LoadResult load(LocalDate date, List<ProcessedTransaction> records) {
        long started = System.nanoTime();
        log.info("Starting load to warehouse | date={} records={}", date, records.size());
        List<String> warnings = records.isEmpty()
                ? List.of("Processed partition for " + date + " has no records")
                : List.of();
        warnings.forEach(log::warn);

        AtomicInteger attempts = new AtomicInteger();
        try {
            LoadResult result = loadRetry.execute(context -> {
                attempts.set(context.getRetryCount() + 1);
                // Whole partition in one transaction; any exception rolls everything back
                return transactionTemplate.execute(status -> loadPartition(date, records, attempts.get(), warnings));
            });
            log.info("Load successful | date={} facts={} dims={} attempts={} durationMs={}",
                    date, result.factsWritten(), result.dimsUpserted(), result.attempts(),
                    (System.nanoTime() - started) / 1_000_000);
            return result;

        } catch (DataIntegrityViolationException e) {
            log.error("Load rejected by warehouse constraints | date={} error={}",
                    date, e.getMostSpecificCause().getMessage());
            throw new IntegrityViolationException("Partition " + date + " violates warehouse constraints", e);

        } catch (DataAccessException e) {
            if (ErrorClassifier.classify(e) != ErrorKind.TRANSIENT_IO) {
                throw e;
            }
            log.error("Load failed after {} attempts | date={}", attempts.get(), date);
            throw new TransientStoreException(
                    "Warehouse unavailable for partition " + date + " after " + attempts.get() + " attempts", e);
        }
    }

    @Override
    public boolean isLoaded(LocalDate date) {
        return repository.isPartitionLoaded(date);
    }

    private LoadResult loadPartition(LocalDate date,
                                     List<ProcessedTransaction> records,
                                     int attempt,
                                     List<String> warnings) {
        repository.clearStaging(date);

        // 1. Dimensions: distinct natural keys, staged then merged
        Map<LocalDate, DateRow> dates = new TreeMap<>();
        Map<String, ChannelRow> channels = new TreeMap<>();
        Map<String, CustomerRow> customers = new TreeMap<>();
        TreeSet<String> cities = new TreeSet<>();
        for (ProcessedTransaction t : records) {
            dates.computeIfAbsent(t.timestamp().toLocalDate(), DateRow::of);
            channels.putIfAbsent(t.channel(), new ChannelRow(t.channel(), t.feePercent()));
            customers.computeIfAbsent(t.customerId(), CustomerProfiles::profileFor);
            cities.add(t.city());
        }

        repository.stageDates(date, dates.values());
        repository.stageChannels(date, channels.values());
        repository.stageCustomers(date, customers.values());
        repository.stageCities(date, cities);

        int dimsUpserted = repository.mergeDates(date)
                + repository.mergeChannels(date)
                + repository.mergeCustomers(date)
                + repository.mergeCities(date);

        // 2. Facts, keyed by transaction id
        repository.stageFacts(date, records);
        List<String> foreign = repository.findFactsOwnedByOtherPartitions(date);
        if (!foreign.isEmpty()) {
            log.error("Transaction ids already loaded by another partition | date={} count={}", date, foreign.size());
            throw new IntegrityViolationException("Partition " + date + " reuses " + foreign.size()
                    + " transaction id(s) owned by another partition: "
                    + foreign.subList(0, Math.min(foreign.size(), MAX_REPORTED_IDS)));
        }
        int factsWritten = repository.mergeFacts(date);

        repository.clearStaging(date);
        repository.recordPartitionLoad(date, factsWritten, dimsUpserted);

        log.debug("Partition merged | date={} dates={} channels={} customers={} cities={} facts={}",
                date, dates.size(), channels.size(), customers.size(), cities.size(), factsWritten);
        return new LoadResult(date, factsWritten, dimsUpserted, attempt, warnings);
    }
}
