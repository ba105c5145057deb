package com.tapas.txnwh.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@Getter
@Setter
@ConfigurationProperties("pipeline.storage")
public class StorageProperties {

    private Path rawDir = Path.of("data", "raw");

    private Path processedDir = Path.of("data", "processed");
}
