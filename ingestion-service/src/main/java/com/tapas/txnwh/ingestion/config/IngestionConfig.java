package com.tapas.txnwh.ingestion.config;

import com.tapas.txnwh.common.codec.CsvRawTransactionCodec;
import com.tapas.txnwh.ingestion.source.ExternalCsvTransactionSource;
import com.tapas.txnwh.ingestion.source.SyntheticTransactionSource;
import com.tapas.txnwh.ingestion.source.TransactionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    @Bean
    public TransactionSource transactionSource(IngestionProperties properties) {
        log.info("Ingestion source: {}", properties.getSource());
        return switch (properties.getSource()) {
            case SYNTHETIC -> new SyntheticTransactionSource(properties);
            case EXTERNAL -> new ExternalCsvTransactionSource(properties.getInboxDir(), new CsvRawTransactionCodec());
        };
    }
}
