package com.tapas.txnwh.common.codec;

import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.error.DataQualityException;
import com.tapas.txnwh.common.partition.PartitionCodec;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw partition format: a headed CSV file with a fixed column order.
 * <p>
 * Reading is lenient per field: a value that does not parse is read as {@code null} and
 * the record is left for the cleaner to drop. A file without the expected columns is rejected.
 */
public class CsvRawTransactionCodec implements PartitionCodec<RawTransaction> {

    private static final Logger log = LoggerFactory.getLogger(CsvRawTransactionCodec.class);

    public static final List<String> COLUMNS = List.of(
            "transaction_id",
            "timestamp",
            "customer_id",
            "channel",
            "city",
            "amount",
            "status",
            "processing_time");

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(COLUMNS.toArray(String[]::new))
            .setRecordSeparator('\n')
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    @Override
    public void write(Path file, List<RawTransaction> records) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
            for (RawTransaction t : records) {
                printer.printRecord(
                        t.transactionId(),
                        TimestampFormat.format(t.timestamp()),
                        t.customerId(),
                        t.channel(),
                        t.city(),
                        plain(t.amount()),
                        t.status(),
                        plain(t.processingTime()));
            }
        }
    }

    @Override
    public List<RawTransaction> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {

            List<String> missing = COLUMNS.stream()
                    .filter(c -> !parser.getHeaderNames().contains(c))
                    .toList();
            if (!missing.isEmpty()) {
                throw new DataQualityException("Raw partition " + file + " is missing columns " + missing);
            }

            List<RawTransaction> records = new ArrayList<>();
            for (CSVRecord row : parser) {
                records.add(new RawTransaction(
                        text(row, "transaction_id"),
                        timestamp(row),
                        text(row, "customer_id"),
                        text(row, "channel"),
                        text(row, "city"),
                        decimal(row, "amount"),
                        text(row, "status"),
                        decimal(row, "processing_time")));
            }
            return records;
        }
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }

    private static String text(CSVRecord row, String column) {
        if (!row.isSet(column)) {
            return null;
        }
        String value = row.get(column);
        return value.isEmpty() ? null : value;
    }

    private static BigDecimal decimal(CSVRecord row, String column) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.debug("Unparseable {} '{}' on line {}", column, value, row.getRecordNumber());
            return null;
        }
    }

    private static LocalDateTime timestamp(CSVRecord row) {
        String value = text(row, "timestamp");
        if (value == null) {
            return null;
        }
        try {
            return TimestampFormat.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}' on line {}", value, row.getRecordNumber());
            return null;
        }
    }
}
