package com.tapas.txnwh.common.error;

/**
 * Data defect that a retry cannot fix, such as an identifier collision or a foreign key violation.
 */
public class IntegrityViolationException extends PipelineException {

    public IntegrityViolationException(String message) {
        super(ErrorKind.INTEGRITY, message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super(ErrorKind.INTEGRITY, message, cause);
    }
}
