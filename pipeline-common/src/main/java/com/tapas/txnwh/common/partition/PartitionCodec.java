package com.tapas.txnwh.common.partition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes one partition's records to a single data file.
 */
public interface PartitionCodec<T> {

    void write(Path file, List<T> records) throws IOException;

    List<T> read(Path file) throws IOException;
}
