package com.tapas.txnwh.common.error;

public class DataQualityException extends PipelineException {

    public DataQualityException(String message) {
        super(ErrorKind.DATA_QUALITY, message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(ErrorKind.DATA_QUALITY, message, cause);
    }
}
