package com.tapas.txnwh.transformation.config;

import com.tapas.txnwh.transformation.service.ChannelFeeTable;
import com.tapas.txnwh.transformation.service.DelayThresholds;
import com.tapas.txnwh.transformation.service.TransactionCleaner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TransformationProperties.class)
public class TransformationConfig {

    @Bean
    public TransactionCleaner transactionCleaner(TransformationProperties properties) {
        return new TransactionCleaner(
                new ChannelFeeTable(properties.getChannelFees()),
                new DelayThresholds(properties.getFastThresholdSeconds(), properties.getSlowThresholdSeconds()));
    }
}
