package com.tapas.txnwh.warehouse.repository;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Staging-then-merge writes into the star schema. Every method expects to run inside the
 * caller's transaction; nothing here commits.
 * <p>
 * Merges use standard {@code MERGE}, which PostgreSQL 15+ and H2 both accept.
 */
@Repository
public class WarehouseRepository {

    private static final int BATCH_SIZE = 500;

    private static final List<String> STAGING_TABLES = List.of(
            "stg_dim_date",
            "stg_dim_channel",
            "stg_dim_customer",
            "stg_dim_city",
            "stg_fact_transactions");

    private final JdbcTemplate jdbcTemplate;

    public WarehouseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void clearStaging(LocalDate partitionDate) {
        for (String table : STAGING_TABLES) {
            jdbcTemplate.update("DELETE FROM " + table + " WHERE partition_date = ?", partitionDate);
        }
    }

    // ---------------------------------------------------------------- dim_date

    public void stageDates(LocalDate partitionDate, Collection<DateRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO stg_dim_date
            (partition_date, full_date, calendar_year, calendar_month, day_of_month, day_of_week, is_weekend)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, rows, BATCH_SIZE, (ps, row) -> {
            ps.setObject(1, partitionDate);
            ps.setObject(2, row.fullDate());
            ps.setInt(3, row.calendarYear());
            ps.setInt(4, row.calendarMonth());
            ps.setInt(5, row.dayOfMonth());
            ps.setInt(6, row.dayOfWeek());
            ps.setBoolean(7, row.weekend());
        });
    }

    /**
     * Calendar attributes follow from the date itself, so existing rows are left alone.
     */
    public int mergeDates(LocalDate partitionDate) {
        String sql = """
            MERGE INTO dim_date AS t
            USING (
                SELECT full_date, calendar_year, calendar_month, day_of_month, day_of_week, is_weekend
                FROM stg_dim_date
                WHERE partition_date = ?
            ) AS s
            ON t.full_date = s.full_date
            WHEN NOT MATCHED THEN
                INSERT (full_date, calendar_year, calendar_month, day_of_month, day_of_week, is_weekend, updated_at)
                VALUES (s.full_date, s.calendar_year, s.calendar_month, s.day_of_month, s.day_of_week,
                        s.is_weekend, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, partitionDate);
    }

    // ------------------------------------------------------------- dim_channel

    public void stageChannels(LocalDate partitionDate, Collection<ChannelRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO stg_dim_channel (partition_date, channel_name, fee_percent)
            VALUES (?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, rows, BATCH_SIZE, (ps, row) -> {
            ps.setObject(1, partitionDate);
            ps.setString(2, row.channelName());
            ps.setBigDecimal(3, row.feePercent());
        });
    }

    public int mergeChannels(LocalDate partitionDate) {
        String sql = """
            MERGE INTO dim_channel AS t
            USING (
                SELECT channel_name, fee_percent
                FROM stg_dim_channel
                WHERE partition_date = ?
            ) AS s
            ON t.channel_name = s.channel_name
            WHEN MATCHED AND t.fee_percent IS DISTINCT FROM s.fee_percent THEN
                UPDATE SET fee_percent = s.fee_percent,
                           updated_at  = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN
                INSERT (channel_name, fee_percent, updated_at)
                VALUES (s.channel_name, s.fee_percent, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, partitionDate);
    }

    // ------------------------------------------------------------ dim_customer

    public void stageCustomers(LocalDate partitionDate, Collection<CustomerRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO stg_dim_customer (partition_date, customer_id, segment, signup_date)
            VALUES (?, ?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, rows, BATCH_SIZE, (ps, row) -> {
            ps.setObject(1, partitionDate);
            ps.setString(2, row.customerId());
            ps.setString(3, row.segment());
            ps.setObject(4, row.signupDate());
        });
    }

    public int mergeCustomers(LocalDate partitionDate) {
        String sql = """
            MERGE INTO dim_customer AS t
            USING (
                SELECT customer_id, segment, signup_date
                FROM stg_dim_customer
                WHERE partition_date = ?
            ) AS s
            ON t.customer_id = s.customer_id
            WHEN MATCHED AND (t.segment IS DISTINCT FROM s.segment
                              OR t.signup_date IS DISTINCT FROM s.signup_date) THEN
                UPDATE SET segment     = s.segment,
                           signup_date = s.signup_date,
                           updated_at  = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN
                INSERT (customer_id, segment, signup_date, updated_at)
                VALUES (s.customer_id, s.segment, s.signup_date, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, partitionDate);
    }

    // ---------------------------------------------------------------- dim_city

    public void stageCities(LocalDate partitionDate, Collection<String> cityNames) {
        if (cityNames.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO stg_dim_city (partition_date, city_name)
            VALUES (?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, cityNames, BATCH_SIZE, (ps, city) -> {
            ps.setObject(1, partitionDate);
            ps.setString(2, city);
        });
    }

    public int mergeCities(LocalDate partitionDate) {
        String sql = """
            MERGE INTO dim_city AS t
            USING (
                SELECT city_name
                FROM stg_dim_city
                WHERE partition_date = ?
            ) AS s
            ON t.city_name = s.city_name
            WHEN NOT MATCHED THEN
                INSERT (city_name, updated_at)
                VALUES (s.city_name, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, partitionDate);
    }

    // ------------------------------------------------------- fact_transactions

    public void stageFacts(LocalDate partitionDate, Collection<ProcessedTransaction> records) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO stg_fact_transactions
            (partition_date, transaction_id, transaction_date, channel_name, customer_id, city_name,
             transaction_ts, amount, status, processing_time, processing_delay_bucket, revenue)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(sql, records, BATCH_SIZE, (ps, t) -> {
            ps.setObject(1, partitionDate);
            ps.setString(2, t.transactionId());
            ps.setObject(3, t.timestamp().toLocalDate());
            ps.setString(4, t.channel());
            ps.setString(5, t.customerId());
            ps.setString(6, t.city());
            ps.setObject(7, t.timestamp());
            ps.setBigDecimal(8, t.amount());
            ps.setString(9, t.status().code());
            ps.setBigDecimal(10, t.processingTime());
            ps.setString(11, t.processingDelayBucket().code());
            ps.setBigDecimal(12, t.revenue());
        });
    }

    /**
     * Staged transaction ids that already exist in the fact table under another partition.
     */
    public List<String> findFactsOwnedByOtherPartitions(LocalDate partitionDate) {
        String sql = """
            SELECT s.transaction_id
            FROM stg_fact_transactions s
            JOIN fact_transactions f ON f.transaction_id = s.transaction_id
            WHERE s.partition_date = ? AND f.partition_date <> ?
            ORDER BY s.transaction_id
            """;
        return jdbcTemplate.queryForList(sql, String.class, partitionDate, partitionDate);
    }

    /**
     * Upserts staged facts keyed by transaction id, overwriting every non-key column.
     * Callers must first rule out ids owned by another partition.
     * Dimension keys are looked up by natural key; an unresolved key lands as NULL and the
     * NOT NULL constraint rejects the whole statement.
     */
    public int mergeFacts(LocalDate partitionDate) {
        String sql = """
            MERGE INTO fact_transactions AS f
            USING (
                SELECT s.transaction_id,
                       s.partition_date,
                       d.date_key,
                       ch.channel_key,
                       cu.customer_key,
                       ci.city_key,
                       s.transaction_ts,
                       s.amount,
                       s.status,
                       s.processing_time,
                       s.processing_delay_bucket,
                       s.revenue
                FROM stg_fact_transactions s
                LEFT JOIN dim_date d      ON d.full_date = s.transaction_date
                LEFT JOIN dim_channel ch  ON ch.channel_name = s.channel_name
                LEFT JOIN dim_customer cu ON cu.customer_id = s.customer_id
                LEFT JOIN dim_city ci     ON ci.city_name = s.city_name
                WHERE s.partition_date = ?
            ) AS src
            ON f.transaction_id = src.transaction_id
            WHEN MATCHED THEN
                UPDATE SET date_key                = src.date_key,
                           channel_key             = src.channel_key,
                           customer_key            = src.customer_key,
                           city_key                = src.city_key,
                           transaction_ts          = src.transaction_ts,
                           amount                  = src.amount,
                           status                  = src.status,
                           processing_time         = src.processing_time,
                           processing_delay_bucket = src.processing_delay_bucket,
                           revenue                 = src.revenue,
                           updated_at              = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN
                INSERT (transaction_id, partition_date, date_key, channel_key, customer_key, city_key,
                        transaction_ts, amount, status, processing_time, processing_delay_bucket, revenue,
                        updated_at)
                VALUES (src.transaction_id, src.partition_date, src.date_key, src.channel_key,
                        src.customer_key, src.city_key,
                        src.transaction_ts, src.amount, src.status, src.processing_time,
                        src.processing_delay_bucket, src.revenue, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, partitionDate);
    }

    // ------------------------------------------------------ etl_partition_load

    public void recordPartitionLoad(LocalDate partitionDate, int factsWritten, int dimsUpserted) {
        int updated = jdbcTemplate.update("""
            UPDATE etl_partition_load
            SET facts_written = ?, dims_upserted = ?, loaded_at = CURRENT_TIMESTAMP
            WHERE partition_date = ?
            """, factsWritten, dimsUpserted, partitionDate);
        if (updated == 0) {
            jdbcTemplate.update("""
                INSERT INTO etl_partition_load (partition_date, facts_written, dims_upserted, loaded_at)
                VALUES (?, ?, ?, CURRENT_TIMESTAMP)
                """, partitionDate, factsWritten, dimsUpserted);
        }
    }

    public boolean isPartitionLoaded(LocalDate partitionDate) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM etl_partition_load WHERE partition_date = ?",
                Integer.class, partitionDate);
        return count != null && count > 0;
    }
}
