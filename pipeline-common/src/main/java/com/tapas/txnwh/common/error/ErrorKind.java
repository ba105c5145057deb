package com.tapas.txnwh.common.error;

public enum ErrorKind {
    /** Store unavailable, network blip. Retried with backoff, then a stage failure. */
    TRANSIENT_IO,
    /** Too many bad records, or none left. */
    DATA_QUALITY,
    /** Duplicate key or referential violation. Never retried. */
    INTEGRITY,
    /** Missing or invalid parameter. Raised before any stage runs. */
    CONFIGURATION,
    /** An upstream partition is absent or incomplete. */
    MISSING_INPUT,
    UNEXPECTED
}
