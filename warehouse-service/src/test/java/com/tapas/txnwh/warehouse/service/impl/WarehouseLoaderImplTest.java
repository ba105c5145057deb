package com.tapas.txnwh.warehouse.service.impl;

import com.tapas.txnwh.common.codec.ParquetProcessedTransactionCodec;
import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.TransactionStatus;
import com.tapas.txnwh.common.error.IntegrityViolationException;
import com.tapas.txnwh.common.error.PartitionNotFoundException;
import com.tapas.txnwh.common.error.TransientStoreException;
import com.tapas.txnwh.common.partition.PartitionStore;
import com.tapas.txnwh.common.retry.RetrySettings;
import com.tapas.txnwh.warehouse.config.WarehouseProperties;
import com.tapas.txnwh.warehouse.repository.WarehouseRepository;
import com.tapas.txnwh.warehouse.service.LoadResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.tapas.txnwh.warehouse.WarehouseTestSupport.newWarehouse;
import static com.tapas.txnwh.warehouse.WarehouseTestSupport.transaction;
import static com.tapas.txnwh.warehouse.WarehouseTestSupport.withStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WarehouseLoaderImplTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);
    private static final LocalDateTime MORNING = LocalDateTime.of(2024, 1, 15, 9, 30);

    @TempDir
    Path processedDir;

    private JdbcTemplate jdbc;
    private DataSourceTransactionManager transactionManager;
    private WarehouseRepository repository;
    private PartitionStore<ProcessedTransaction> processedStore;
    private WarehouseProperties properties;

    @BeforeEach
    void setUp() {
        DataSource dataSource = newWarehouse();
        jdbc = new JdbcTemplate(dataSource);
        transactionManager = new DataSourceTransactionManager(dataSource);
        repository = spy(new WarehouseRepository(jdbc));
        processedStore = new PartitionStore<>("processed", processedDir, "cleaned_transactions.parquet",
                new ParquetProcessedTransactionCodec());
        properties = new WarehouseProperties();
        properties.setRetry(RetrySettings.immediate(3));
    }

    @Test
    void loadsDimensionsAndFacts() {
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS),
                transaction("TXN-2", "CUST-000002", "UPI", "Mumbai", MORNING.plusHours(2), "40.00", TransactionStatus.FAILED),
                transaction("TXN-3", "CUST-000001", "UPI", "Delhi", MORNING.plusHours(3), "12.00", TransactionStatus.SUCCESS));

        LoadResult result = loader().load(DATE, records);

        assertThat(result.factsWritten()).isEqualTo(3);
        // 1 date + 2 channels + 2 customers + 2 cities
        assertThat(result.dimsUpserted()).isEqualTo(7);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.warnings()).isEmpty();
        assertThat(count("fact_transactions")).isEqualTo(3);
        assertThat(count("dim_date")).isEqualTo(1);
        assertThat(count("dim_channel")).isEqualTo(2);
        assertThat(count("dim_customer")).isEqualTo(2);
        assertThat(count("dim_city")).isEqualTo(2);
        assertThat(count("stg_fact_transactions")).isZero();
        assertThat(loader().isLoaded(DATE)).isTrue();

        Map<String, Object> fact = jdbc.queryForMap("""
                SELECT f.revenue, f.status, ch.channel_name, ci.city_name, d.full_date, d.is_weekend
                FROM fact_transactions f
                JOIN dim_channel ch ON ch.channel_key = f.channel_key
                JOIN dim_city ci ON ci.city_key = f.city_key
                JOIN dim_date d ON d.date_key = f.date_key
                WHERE f.transaction_id = 'TXN-1'
                """);
        assertThat((BigDecimal) fact.get("REVENUE")).isEqualByComparingTo("2.50");
        assertThat(fact.get("STATUS")).isEqualTo("success");
        assertThat(fact.get("CHANNEL_NAME")).isEqualTo("Credit Card");
        assertThat(fact.get("CITY_NAME")).isEqualTo("Mumbai");
        assertThat(fact.get("IS_WEEKEND")).isEqualTo(false);
    }

    @Test
    void reloadingTheSamePartitionChangesNothing() {
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS),
                transaction("TXN-2", "CUST-000002", "Net Banking", "Pune", MORNING, "75.50", TransactionStatus.FAILED));

        loader().load(DATE, records);
        List<Map<String, Object>> before = snapshot();

        LoadResult second = loader().load(DATE, records);

        assertThat(second.dimsUpserted()).isZero();
        assertThat(snapshot()).isEqualTo(before);
        assertThat(count("fact_transactions")).isEqualTo(2);
        assertThat(count("etl_partition_load")).isEqualTo(1);
    }

    @Test
    void correctedStatusUpdatesTheExistingFact() {
        ProcessedTransaction failed =
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.FAILED);
        loader().load(DATE, List.of(failed));

        ProcessedTransaction corrected = withStatus(failed, TransactionStatus.SUCCESS);
        loader().load(DATE, List.of(corrected));

        assertThat(count("fact_transactions")).isEqualTo(1);
        Map<String, Object> fact = jdbc.queryForMap(
                "SELECT status, revenue FROM fact_transactions WHERE transaction_id = 'TXN-1'");
        assertThat(fact.get("STATUS")).isEqualTo("success");
        assertThat((BigDecimal) fact.get("REVENUE")).isEqualByComparingTo("2.50");
    }

    @Test
    void transactionIdOwnedByAnotherPartitionIsRejectedWithoutRetry() {
        LocalDate nextDay = DATE.plusDays(1);
        loader().load(DATE, List.of(
                transaction("EXT-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS)));
        List<Map<String, Object>> before = snapshot();

        List<ProcessedTransaction> reused = List.of(
                transaction("EXT-1", "CUST-000001", "Credit Card", "Mumbai", MORNING.plusDays(1), "999.00",
                        TransactionStatus.FAILED),
                transaction("EXT-2", "CUST-000002", "UPI", "Pune", MORNING.plusDays(1), "10.00", TransactionStatus.SUCCESS));

        assertThatThrownBy(() -> loader().load(nextDay, reused))
                .isInstanceOf(IntegrityViolationException.class)
                .hasMessageContaining("2024-01-16")
                .hasMessageContaining("EXT-1");

        verify(repository, times(1)).findFactsOwnedByOtherPartitions(nextDay);
        verify(repository, never()).mergeFacts(nextDay);
        assertThat(snapshot()).isEqualTo(before);
        assertThat(jdbc.queryForObject(
                "SELECT partition_date FROM fact_transactions WHERE transaction_id = 'EXT-1'", LocalDate.class))
                .isEqualTo(DATE);
        assertThat(count("dim_date")).isEqualTo(1);
        assertThat(count("stg_fact_transactions")).isZero();
        assertThat(loader().isLoaded(nextDay)).isFalse();
        assertThat(loader().isLoaded(DATE)).isTrue();
    }

    @Test
    void failedFactMergeRollsBackDimensionUpserts() {
        doThrow(new DataIntegrityViolationException("fact merge rejected")).when(repository).mergeFacts(any());
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS));

        assertThatThrownBy(() -> loader().load(DATE, records))
                .isInstanceOf(IntegrityViolationException.class);

        assertThat(count("dim_date")).isZero();
        assertThat(count("dim_channel")).isZero();
        assertThat(count("dim_customer")).isZero();
        assertThat(count("dim_city")).isZero();
        assertThat(count("fact_transactions")).isZero();
        assertThat(count("stg_dim_channel")).isZero();
        assertThat(loader().isLoaded(DATE)).isFalse();
    }

    @Test
    void unresolvedDimensionKeyIsAnIntegrityViolationAndNotRetried() {
        // channel dimension never merged, so the fact cannot resolve its channel key
        doReturn(0).when(repository).mergeChannels(any());
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS));

        assertThatThrownBy(() -> loader().load(DATE, records))
                .isInstanceOf(IntegrityViolationException.class);

        verify(repository, times(1)).mergeFacts(DATE);
        assertThat(count("fact_transactions")).isZero();
        assertThat(count("dim_customer")).isZero();
    }

    @Test
    void transientFailuresAreRetried() {
        doThrow(new TransientDataAccessResourceException("connection reset"))
                .doThrow(new TransientDataAccessResourceException("connection reset"))
                .doCallRealMethod()
                .when(repository).mergeFacts(any());
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS));

        LoadResult result = loader().load(DATE, records);

        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.factsWritten()).isEqualTo(1);
        assertThat(count("fact_transactions")).isEqualTo(1);
        assertThat(count("dim_channel")).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesSurfaceAsTransientStoreFailure() {
        doThrow(new TransientDataAccessResourceException("connection reset")).when(repository).mergeFacts(any());
        List<ProcessedTransaction> records = List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS));

        assertThatThrownBy(() -> loader().load(DATE, records))
                .isInstanceOf(TransientStoreException.class)
                .hasMessageContaining("3 attempts");

        verify(repository, times(3)).mergeFacts(DATE);
        assertThat(count("dim_channel")).isZero();
    }

    @Test
    void loadsFromTheProcessedPartition() throws IOException {
        processedStore.publish(DATE, List.of(
                transaction("TXN-1", "CUST-000001", "Credit Card", "Mumbai", MORNING, "100.00", TransactionStatus.SUCCESS)));

        LoadResult result = loader().load(DATE);

        assertThat(result.factsWritten()).isEqualTo(1);
        assertThat(count("fact_transactions")).isEqualTo(1);
    }

    @Test
    void missingProcessedPartitionIsReported() {
        assertThatThrownBy(() -> loader().load(DATE)).isInstanceOf(PartitionNotFoundException.class);
        assertThat(loader().isLoaded(DATE)).isFalse();
    }

    @Test
    void emptyPartitionLoadsWithWarning() {
        LoadResult result = loader().load(DATE, List.of());

        assertThat(result.factsWritten()).isZero();
        assertThat(result.warnings()).hasSize(1);
        assertThat(loader().isLoaded(DATE)).isTrue();
    }

    private WarehouseLoaderImpl loader() {
        return new WarehouseLoaderImpl(processedStore, repository, transactionManager, properties);
    }

    private int count(String table) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    private List<Map<String, Object>> snapshot() {
        return jdbc.queryForList("""
                SELECT f.transaction_id, f.transaction_ts, f.amount, f.status, f.revenue,
                       f.processing_time, f.processing_delay_bucket,
                       d.full_date, ch.channel_name, ch.fee_percent, cu.customer_id, cu.segment, cu.signup_date,
                       ci.city_name
                FROM fact_transactions f
                JOIN dim_date d ON d.date_key = f.date_key
                JOIN dim_channel ch ON ch.channel_key = f.channel_key
                JOIN dim_customer cu ON cu.customer_key = f.customer_key
                JOIN dim_city ci ON ci.city_key = f.city_key
                ORDER BY f.transaction_id
                """);
    }
}
