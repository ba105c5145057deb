package com.tapas.txnwh.common.retry;

import com.tapas.txnwh.common.error.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

import java.util.List;

public final class RetryTemplates {

    private static final Logger log = LoggerFactory.getLogger(RetryTemplates.class);

    private RetryTemplates() {
    }

    /**
     * Builds a template that retries only the given exception types (and causes of
     * those types) with a fixed backoff, logging every failed attempt.
     */
    public static RetryTemplate fixedBackoff(String operation,
                                             RetrySettings settings,
                                             List<Class<? extends Throwable>> retryOn) {
        if (settings.getMaxAttempts() < 1) {
            throw new InvalidConfigurationException(
                    "retry.max-attempts must be >= 1 for " + operation + ", got " + settings.getMaxAttempts());
        }
        long backoffMillis = settings.getBackoff() == null ? 0 : settings.getBackoff().toMillis();
        if (backoffMillis < 0) {
            throw new InvalidConfigurationException("retry.backoff must not be negative for " + operation);
        }

        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(settings.getMaxAttempts())
                .retryOn(retryOn)
                .traversingCauses()
                .withListener(new AttemptLogger(operation, settings.getMaxAttempts()));

        if (backoffMillis == 0) {
            builder.noBackoff();
        } else {
            builder.fixedBackoff(backoffMillis);
        }
        return builder.build();
    }

    private static final class AttemptLogger implements RetryListener {

        private final String operation;
        private final int maxAttempts;

        AttemptLogger(String operation, int maxAttempts) {
            this.operation = operation;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context,
                                                     RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            log.warn("{} attempt {}/{} failed: {}",
                    operation, context.getRetryCount(), maxAttempts, throwable.toString());
        }
    }
}
