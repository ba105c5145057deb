package com.tapas.txnwh.common.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * {@code yyyy-MM-dd HH:mm:ss[.fraction]}, the timestamp text shared by the CSV files
 * and DuckDB's TIMESTAMP casts.
 */
public final class TimestampFormat {

    public static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private TimestampFormat() {
    }

    public static String format(LocalDateTime timestamp) {
        return timestamp == null ? null : FORMATTER.format(timestamp);
    }

    public static LocalDateTime parse(String text) {
        return LocalDateTime.parse(text.trim(), FORMATTER);
    }
}
