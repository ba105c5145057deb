package com.tapas.txnwh.ingestion.source;

import com.tapas.txnwh.common.codec.CsvRawTransactionCodec;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.error.PartitionNotFoundException;
import com.tapas.txnwh.ingestion.service.GenerationRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks up an externally produced extract, {@code <inbox>/YYYY-MM-DD.csv}, in the raw
 * partition column layout. Count and failure rate of the request do not apply.
 */
@Slf4j
public class ExternalCsvTransactionSource implements TransactionSource {

    private final Path inboxDir;
    private final CsvRawTransactionCodec codec;

    public ExternalCsvTransactionSource(Path inboxDir, CsvRawTransactionCodec codec) {
        this.inboxDir = inboxDir;
        this.codec = codec;
    }

    @Override
    public List<RawTransaction> fetch(GenerationRequest request) throws IOException {
        Path file = inboxDir.resolve(request.date() + ".csv");
        if (!Files.isRegularFile(file)) {
            throw new PartitionNotFoundException("No external extract for " + request.date() + " at " + file);
        }
        List<RawTransaction> records = codec.read(file);
        log.info("Read external extract | date={} records={} file={}", request.date(), records.size(), file);
        return records;
    }

    @Override
    public boolean assignsIdentifiers() {
        return false;
    }
}
