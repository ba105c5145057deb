package com.tapas.txnwh.common.error;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

public final class ErrorClassifier {

    /**
     * Exceptions that indicate an unavailable store rather than bad data.
     */
    public static final List<Class<? extends Throwable>> TRANSIENT_DATA_ACCESS = List.of(
            TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            DataAccessResourceFailureException.class);

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        if (error instanceof PipelineException pe) {
            return pe.getKind();
        }
        if (error instanceof DataIntegrityViolationException) {
            return ErrorKind.INTEGRITY;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return ErrorKind.TRANSIENT_IO;
        }
        for (Class<? extends Throwable> type : TRANSIENT_DATA_ACCESS) {
            if (type.isInstance(error)) {
                return ErrorKind.TRANSIENT_IO;
            }
        }
        return ErrorKind.UNEXPECTED;
    }
}
