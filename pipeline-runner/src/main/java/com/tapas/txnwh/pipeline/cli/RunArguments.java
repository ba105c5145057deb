package com.tapas.txnwh.pipeline.cli;

import com.tapas.txnwh.common.error.InvalidConfigurationException;
import com.tapas.txnwh.pipeline.runner.RunOptions;
import com.tapas.txnwh.pipeline.runner.Stage;
import org.springframework.boot.ApplicationArguments;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Command line options of the pipeline.
 * <pre>
 *   --date=2024-01-15                 single run (default: yesterday)
 *   --from=2024-01-01 --to=2024-01-07 backfill, with --parallelism=N
 *   --stages=ingest,transform,load    subset of stages
 *   --force                           re-run stages whose output is complete
 * </pre>
 * Options containing a dot are Spring properties and are left to Spring Boot.
 */
public record RunArguments(LocalDate from, LocalDate to, RunOptions options, int parallelism) {

    static final Set<String> KNOWN_OPTIONS = Set.of("date", "from", "to", "stages", "force", "parallelism");

    public boolean isRange() {
        return !from.equals(to);
    }

    public static RunArguments parse(ApplicationArguments args, Clock clock) {
        for (String name : args.getOptionNames()) {
            if (!name.contains(".") && !KNOWN_OPTIONS.contains(name)) {
                throw new InvalidConfigurationException("Unknown option --" + name);
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new InvalidConfigurationException("Unexpected arguments: " + args.getNonOptionArgs());
        }

        LocalDate from;
        LocalDate to;
        boolean hasRange = args.containsOption("from") || args.containsOption("to");
        if (hasRange) {
            if (args.containsOption("date")) {
                throw new InvalidConfigurationException("--date cannot be combined with --from/--to");
            }
            from = parseDate("from", single(args, "from"));
            to = parseDate("to", single(args, "to"));
            if (from.isAfter(to)) {
                throw new InvalidConfigurationException("--from " + from + " is after --to " + to);
            }
        } else if (args.containsOption("date")) {
            from = parseDate("date", single(args, "date"));
            to = from;
        } else {
            from = LocalDate.now(clock).minusDays(1);
            to = from;
        }

        Set<Stage> stages = args.containsOption("stages")
                ? parseStages(single(args, "stages"))
                : EnumSet.allOf(Stage.class);
        boolean force = args.containsOption("force") && parseFlag(args.getOptionValues("force"));

        int parallelism = 1;
        if (args.containsOption("parallelism")) {
            String value = single(args, "parallelism");
            try {
                parallelism = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("--parallelism must be an integer, got '" + value + "'", e);
            }
            if (parallelism < 1) {
                throw new InvalidConfigurationException("--parallelism must be >= 1, got " + parallelism);
            }
        }

        return new RunArguments(from, to, new RunOptions(stages, force), parallelism);
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new InvalidConfigurationException("--" + name + " expects exactly one value");
        }
        return values.get(0);
    }

    private static LocalDate parseDate(String name, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException("--" + name + " must be YYYY-MM-DD, got '" + value + "'", e);
        }
    }

    private static Set<Stage> parseStages(String value) {
        Set<Stage> stages = EnumSet.noneOf(Stage.class);
        for (String code : value.split(",")) {
            if (code.isBlank()) {
                continue;
            }
            stages.add(Stage.fromCode(code)
                    .orElseThrow(() -> new InvalidConfigurationException("Unknown stage '" + code.trim() + "'")));
        }
        if (stages.isEmpty()) {
            throw new InvalidConfigurationException("--stages must name at least one stage");
        }
        return stages;
    }

    // --force and --force=true both enable it
    private static boolean parseFlag(List<String> values) {
        if (values == null || values.isEmpty()) {
            return true;
        }
        String value = values.get(0).trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new InvalidConfigurationException("--force takes no value or true/false, got '" + value + "'");
    }
}
