package com.tapas.txnwh.common.error;

/**
 * Base class for failures raised by pipeline stages. Every failure carries the
 * {@link ErrorKind} the runner reports when it halts.
 */
public class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
