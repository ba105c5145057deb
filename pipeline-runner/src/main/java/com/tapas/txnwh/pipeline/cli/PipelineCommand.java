package com.tapas.txnwh.pipeline.cli;

import com.tapas.txnwh.common.error.ErrorKind;
import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.pipeline.runner.PipelineResult;
import com.tapas.txnwh.pipeline.runner.PipelineRunner;
import com.tapas.txnwh.pipeline.runner.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
@Slf4j
public class PipelineCommand implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_STAGE_FAILED = 1;
    public static final int EXIT_INVALID_INPUT = 2;

    private final PipelineRunner runner;
    private final Clock clock;

    private volatile int exitCode = EXIT_OK;

    public PipelineCommand(PipelineRunner runner, Clock clock) {
        this.runner = runner;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunArguments arguments;
        try {
            arguments = RunArguments.parse(args, clock);
        } catch (InvalidConfigurationException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_INVALID_INPUT;
            return;
        }

        List<PipelineResult> results = arguments.isRange()
                ? runner.runRange(arguments.from(), arguments.to(), arguments.options(), arguments.parallelism())
                : List.of(runner.run(arguments.from(), arguments.options()));
        exitCode = exitCodeFor(results);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(List<PipelineResult> results) {
        int code = EXIT_OK;
        for (PipelineResult result : results) {
            StageResult failure = result.failure().orElse(null);
            if (failure == null) {
                continue;
            }
            if (failure.errorKind() == ErrorKind.CONFIGURATION) {
                return EXIT_INVALID_INPUT;
            }
            code = EXIT_STAGE_FAILED;
        }
        return code;
    }
}
