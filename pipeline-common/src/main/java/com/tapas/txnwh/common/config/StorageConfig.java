package com.tapas.txnwh.common.config;

import com.tapas.txnwh.common.codec.CsvRawTransactionCodec;
import com.tapas.txnwh.common.codec.ParquetProcessedTransactionCodec;
import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.partition.PartitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Partition stores shared by the stages: the generator writes raw partitions, the cleaner
 * reads them and writes processed partitions, the loader reads those.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    public static final String RAW_FILE = "transactions.csv";
    public static final String PROCESSED_FILE = "cleaned_transactions.parquet";

    @Bean
    public PartitionStore<RawTransaction> rawPartitionStore(StorageProperties properties) {
        log.info("Raw partitions under {}", properties.getRawDir().toAbsolutePath());
        return new PartitionStore<>("raw", properties.getRawDir(), RAW_FILE, new CsvRawTransactionCodec());
    }

    @Bean
    public PartitionStore<ProcessedTransaction> processedPartitionStore(StorageProperties properties) {
        log.info("Processed partitions under {}", properties.getProcessedDir().toAbsolutePath());
        return new PartitionStore<>("processed", properties.getProcessedDir(), PROCESSED_FILE,
                new ParquetProcessedTransactionCodec());
    }
}
