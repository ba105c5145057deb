package com.tapas.txnwh.ingestion.source;

import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.domain.TransactionStatus;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.ingestion.config.IngestionProperties;
import com.tapas.txnwh.ingestion.service.GenerationRequest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

/**
 * Generates plausible transactions. The random stream is seeded from the configured seed
 * and the date, so the same date always yields the same records.
 */
public class SyntheticTransactionSource implements TransactionSource {

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    private final IngestionProperties properties;

    public SyntheticTransactionSource(IngestionProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<RawTransaction> fetch(GenerationRequest request) {
        validate(properties);
        Random random = new Random(properties.getSeed() * 31 + request.date().toEpochDay());
        String idPrefix = "TXN-" + request.date().format(DateTimeFormatter.BASIC_ISO_DATE) + "-";
        LocalDateTime dayStart = request.date().atStartOfDay();
        List<String> channels = request.channels();
        List<String> cities = properties.getCities();

        List<RawTransaction> records = new ArrayList<>(request.count());
        for (int i = 0; i < request.count(); i++) {
            TransactionStatus status = random.nextDouble() < request.failureRate()
                    ? TransactionStatus.FAILED
                    : TransactionStatus.SUCCESS;

            records.add(new RawTransaction(
                    idPrefix + HexFormat.of().toHexDigits(random.nextLong()),
                    dayStart.plusSeconds(random.nextInt(SECONDS_PER_DAY)),
                    String.format("CUST-%06d", 1 + random.nextInt(properties.getCustomerPoolSize())),
                    channels.get(random.nextInt(channels.size())),
                    cities.get(random.nextInt(cities.size())),
                    decimal(10 + random.nextDouble() * 990),
                    status.code(),
                    decimal(0.5 + random.nextDouble() * 7.5)));
        }
        return records;
    }

    private static void validate(IngestionProperties properties) {
        List<String> cities = properties.getCities();
        if (cities == null || cities.isEmpty() || cities.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new InvalidConfigurationException("pipeline.ingestion.cities must list at least one city");
        }
        if (properties.getCustomerPoolSize() <= 0) {
            throw new InvalidConfigurationException(
                    "pipeline.ingestion.customer-pool-size must be positive, got " + properties.getCustomerPoolSize());
        }
    }

    private static BigDecimal decimal(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
