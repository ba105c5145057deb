package com.tapas.txnwh.pipeline.config;

import com.tapas.txnwh.common.error.InvalidConfigurationException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(RunnerProperties.class)
public class RunnerConfig {

    @Bean
    public Clock pipelineClock(RunnerProperties properties) {
        try {
            return Clock.system(ZoneId.of(properties.getZone()));
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("Unknown pipeline.runner.zone: " + properties.getZone(), e);
        }
    }
}
