package com.tapas.txnwh.pipeline;

import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.pipeline.cli.PipelineCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.bind.BindException;

@SpringBootApplication(scanBasePackages = "com.tapas.txnwh")
public class PipelineApplication {

    public static void main(String[] args) {
        try {
            System.exit(SpringApplication.exit(SpringApplication.run(PipelineApplication.class, args)));
        } catch (RuntimeException e) {
            // Context refresh failed; bad configuration gets its own exit code
            if (isConfigurationError(e)) {
                System.exit(PipelineCommand.EXIT_INVALID_INPUT);
            }
            throw e;
        }
    }

    static boolean isConfigurationError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof InvalidConfigurationException || t instanceof BindException) {
                return true;
            }
        }
        return false;
    }
}
