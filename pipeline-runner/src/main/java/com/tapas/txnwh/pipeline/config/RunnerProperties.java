package com.tapas.txnwh.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties("pipeline.runner")
public class RunnerProperties {

    /** Zone used to resolve "yesterday" when no run date is given. */
    private String zone = "UTC";
}
