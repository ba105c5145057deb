package com.tapas.txnwh.pipeline.runner;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.domain.RawTransaction;
import com.tapas.txnwh.common.error.ErrorClassifier;
import com.tapas.txnwh.common.error.ErrorKind;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.common.partition.PartitionStore;
import com.tapas.txnwh.ingestion.service.GenerationReport;
import com.tapas.txnwh.ingestion.service.TransactionGenerator;
import com.tapas.txnwh.transformation.service.TransformReport;
import com.tapas.txnwh.transformation.service.TransformationService;
import com.tapas.txnwh.warehouse.service.LoadResult;
import com.tapas.txnwh.warehouse.service.WarehouseLoader;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs ingest, transform and load for a date. A stage whose output is already complete is
 * skipped unless forced or unless an upstream stage produced new input in the same run.
 */
@Service
@Slf4j
public class PipelineRunner {

    public static final String MDC_STAGE = "stage";
    public static final String MDC_RUN_DATE = "runDate";

    private final TransactionGenerator generator;
    private final TransformationService transformationService;
    private final WarehouseLoader warehouseLoader;
    private final PartitionStore<RawTransaction> rawStore;
    private final PartitionStore<ProcessedTransaction> processedStore;

    public PipelineRunner(TransactionGenerator generator,
                          TransformationService transformationService,
                          WarehouseLoader warehouseLoader,
                          PartitionStore<RawTransaction> rawStore,
                          PartitionStore<ProcessedTransaction> processedStore) {
        this.generator = generator;
        this.transformationService = transformationService;
        this.warehouseLoader = warehouseLoader;
        this.rawStore = rawStore;
        this.processedStore = processedStore;
    }

    public PipelineResult run(LocalDate date) {
        return run(date, RunOptions.defaults());
    }

    public PipelineResult run(LocalDate date, RunOptions options) {
        if (date == null) {
            throw new InvalidConfigurationException("Run date is required");
        }
        long started = System.nanoTime();
        List<StageResult> results = new ArrayList<>();
        boolean upstreamRan = false;

        MDC.put(MDC_RUN_DATE, date.toString());
        try {
            log.info("Pipeline started | date={} stages={} force={}", date, options.stages(), options.force());

            for (Stage stage : Stage.values()) {
                if (!options.includes(stage)) {
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Pipeline interrupted before {} | date={}", stage.code(), date);
                    results.add(StageResult.aborted(stage));
                    break;
                }
                if (!options.force() && !upstreamRan) {
                    StageResult skipped = skipIfComplete(stage, date);
                    if (skipped != null) {
                        results.add(skipped);
                        if (skipped.status() == StageStatus.FAILED) {
                            break;
                        }
                        continue;
                    }
                }

                StageResult result = execute(stage, date);
                results.add(result);
                if (result.status() == StageStatus.FAILED) {
                    break;
                }
                upstreamRan = true;
            }

            PipelineResult pipelineResult = new PipelineResult(date, List.copyOf(results));
            long durationMs = (System.nanoTime() - started) / 1_000_000;
            pipelineResult.failure().ifPresentOrElse(
                    f -> log.error("Pipeline failed | date={} stage={} status={} kind={} durationMs={}",
                            date, f.stage().code(), f.status(), f.errorKind(), durationMs),
                    () -> log.info("Pipeline completed | date={} completed={} durationMs={}",
                            date, pipelineResult.stagesCompleted(), durationMs));
            return pipelineResult;
        } finally {
            MDC.remove(MDC_RUN_DATE);
        }
    }

    /**
     * Backfill: one independent run per date on a fixed pool. Results come back in date order.
     */
    public List<PipelineResult> runRange(LocalDate from, LocalDate to, RunOptions options, int parallelism) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new InvalidConfigurationException("Invalid date range: " + from + " .. " + to);
        }
        if (parallelism < 1) {
            throw new InvalidConfigurationException("parallelism must be >= 1, got " + parallelism);
        }

        List<LocalDate> dates = from.datesUntil(to.plusDays(1)).toList();
        log.info("Backfill started | from={} to={} dates={} parallelism={}", from, to, dates.size(), parallelism);

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, dates.size()));
        try {
            List<Future<PipelineResult>> futures = new ArrayList<>();
            for (LocalDate date : dates) {
                futures.add(executor.submit(() -> run(date, options)));
            }

            List<PipelineResult> results = new ArrayList<>();
            for (int i = 0; i < dates.size(); i++) {
                results.add(await(dates.get(i), futures.get(i), options));
            }
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Backfill finished | dates={} failed={}", results.size(), failed);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private PipelineResult await(LocalDate date, Future<PipelineResult> future, RunOptions options) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new PipelineResult(date, List.of(StageResult.aborted(firstStage(options))));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Pipeline run crashed | date={}", date, cause);
            return new PipelineResult(date, List.of(StageResult.failed(
                    firstStage(options), ErrorClassifier.classify(cause), String.valueOf(cause), Duration.ZERO)));
        }
    }

    private static Stage firstStage(RunOptions options) {
        for (Stage stage : Stage.values()) {
            if (options.includes(stage)) {
                return stage;
            }
        }
        return Stage.INGEST;
    }

    /**
     * Returns a SKIPPED result when the stage output already exists, a FAILED result when
     * completeness cannot be determined, and {@code null} when the stage has to run.
     */
    private StageResult skipIfComplete(Stage stage, LocalDate date) {
        long started = System.nanoTime();
        MDC.put(MDC_STAGE, stage.code());
        try {
            boolean complete = switch (stage) {
                case INGEST -> rawStore.isComplete(date);
                case TRANSFORM -> processedStore.isComplete(date);
                case LOAD -> warehouseLoader.isLoaded(date);
            };
            if (!complete) {
                return null;
            }
            log.info("Skipping {} | date={} reason=output already complete", stage.code(), date);
            return StageResult.skipped(stage, "output already complete");
        } catch (RuntimeException e) {
            return failure(stage, date, e, started);
        } finally {
            MDC.remove(MDC_STAGE);
        }
    }

    private StageResult execute(Stage stage, LocalDate date) {
        long started = System.nanoTime();
        MDC.put(MDC_STAGE, stage.code());
        try {
            log.info("Stage started | stage={} date={}", stage.code(), date);
            StageResult result = switch (stage) {
                case INGEST -> {
                    GenerationReport report = generator.generate(date);
                    yield StageResult.completed(stage,
                            "records=" + report.recordsGenerated() + " attempts=" + report.writeAttempts(),
                            List.of(), report.elapsed());
                }
                case TRANSFORM -> {
                    TransformReport report = transformationService.transform(date);
                    yield StageResult.completed(stage,
                            "input=" + report.inputRecords()
                                    + " duplicates=" + report.duplicatesRemoved()
                                    + " dropped=" + (report.invalidDropped() + report.unknownChannelDropped())
                                    + " output=" + report.outputRecords(),
                            report.warnings(), report.elapsed());
                }
                case LOAD -> {
                    LoadResult loaded = warehouseLoader.load(date);
                    yield StageResult.completed(stage,
                            "facts=" + loaded.factsWritten() + " dims=" + loaded.dimsUpserted()
                                    + " attempts=" + loaded.attempts(),
                            loaded.warnings(), elapsed(started));
                }
            };
            log.info("Stage finished | stage={} date={} status={} {}", stage.code(), date, result.status(), result.detail());
            return result;

        } catch (RuntimeException e) {
            return failure(stage, date, e, started);
        } finally {
            MDC.remove(MDC_STAGE);
        }
    }

    private StageResult failure(Stage stage, LocalDate date, RuntimeException e, long startedNanos) {
        ErrorKind kind = ErrorClassifier.classify(e);
        if (kind == ErrorKind.UNEXPECTED) {
            log.error("Stage failed | stage={} date={} kind={}", stage.code(), date, kind, e);
        } else {
            log.error("Stage failed | stage={} date={} kind={} error={}", stage.code(), date, kind, e.getMessage());
        }
        return StageResult.failed(stage, kind, e.getMessage(), elapsed(startedNanos));
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
