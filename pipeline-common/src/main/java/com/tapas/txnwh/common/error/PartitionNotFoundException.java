package com.tapas.txnwh.common.error;

public class PartitionNotFoundException extends PipelineException {

    public PartitionNotFoundException(String message) {
        super(ErrorKind.MISSING_INPUT, message);
    }

    public PartitionNotFoundException(String message, Throwable cause) {
        super(ErrorKind.MISSING_INPUT, message, cause);
    }
}
