package com.tapas.txnwh.common.codec;

import com.tapas.txnwh.common.domain.DelayBucket;
import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.TransactionStatus;
import com.tapas.txnwh.common.partition.PartitionCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Processed partition format: a ZSTD-compressed Parquet file written and read through an
 * in-process DuckDB database. {@code record_seq} keeps the cleaner's output order.
 */
public class ParquetProcessedTransactionCodec implements PartitionCodec<ProcessedTransaction> {

    private static final String DUCKDB_URL = "jdbc:duckdb:";

    private static final String CREATE_TABLE = """
            CREATE TABLE processed (
                record_seq              INTEGER,
                transaction_id          VARCHAR,
                transaction_ts          TIMESTAMP,
                customer_id             VARCHAR,
                channel                 VARCHAR,
                city                    VARCHAR,
                amount                  DECIMAL(18, 2),
                status                  VARCHAR,
                processing_time         DECIMAL(10, 3),
                fee_percent             DECIMAL(7, 4),
                revenue                 DECIMAL(18, 2),
                processing_delay_bucket VARCHAR
            )
            """;

    private static final String INSERT = """
            INSERT INTO processed VALUES
            (?, ?, CAST(? AS TIMESTAMP), ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT = """
            SELECT transaction_id,
                   CAST(transaction_ts AS VARCHAR) AS transaction_ts,
                   customer_id, channel, city, amount, status,
                   processing_time, fee_percent, revenue, processing_delay_bucket
            FROM read_parquet('%s')
            ORDER BY record_seq
            """;

    @Override
    public void write(Path file, List<ProcessedTransaction> records) throws IOException {
        try (Connection conn = DriverManager.getConnection(DUCKDB_URL);
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);

            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                int seq = 0;
                for (ProcessedTransaction t : records) {
                    ps.setInt(1, seq++);
                    ps.setString(2, t.transactionId());
                    ps.setString(3, TimestampFormat.format(t.timestamp()));
                    ps.setString(4, t.customerId());
                    ps.setString(5, t.channel());
                    ps.setString(6, t.city());
                    ps.setBigDecimal(7, t.amount());
                    ps.setString(8, t.status().code());
                    ps.setBigDecimal(9, t.processingTime());
                    ps.setBigDecimal(10, t.feePercent());
                    ps.setBigDecimal(11, t.revenue());
                    ps.setString(12, t.processingDelayBucket().code());
                    ps.executeUpdate();
                }
            }
            conn.commit();
            conn.setAutoCommit(true);

            stmt.execute("COPY processed TO '" + literal(file) + "' (FORMAT PARQUET, COMPRESSION ZSTD)");
        } catch (SQLException e) {
            throw new IOException("Failed to write processed partition " + file, e);
        }
    }

    @Override
    public List<ProcessedTransaction> read(Path file) throws IOException {
        List<ProcessedTransaction> records = new ArrayList<>();
        try (Connection conn = DriverManager.getConnection(DUCKDB_URL);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(String.format(SELECT, literal(file)))) {
            while (rs.next()) {
                records.add(new ProcessedTransaction(
                        rs.getString("transaction_id"),
                        TimestampFormat.parse(rs.getString("transaction_ts")),
                        rs.getString("customer_id"),
                        rs.getString("channel"),
                        rs.getString("city"),
                        rs.getBigDecimal("amount"),
                        TransactionStatus.fromCode(rs.getString("status"))
                                .orElseThrow(() -> new IllegalStateException("Corrupt status in " + file)),
                        rs.getBigDecimal("processing_time"),
                        rs.getBigDecimal("fee_percent"),
                        rs.getBigDecimal("revenue"),
                        DelayBucket.fromCode(rs.getString("processing_delay_bucket"))));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read processed partition " + file, e);
        }
        return records;
    }

    private static String literal(Path file) {
        return file.toAbsolutePath().toString().replace("'", "''");
    }
}
