package com.tapas.txnwh.common.error;

/**
 * Raised when a store stayed unavailable after all retry attempts.
 */
public class TransientStoreException extends PipelineException {

    public TransientStoreException(String message) {
        super(ErrorKind.TRANSIENT_IO, message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_IO, message, cause);
    }
}
