package com.tapas.txnwh.common.error;

public class InvalidConfigurationException extends PipelineException {

    public InvalidConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
