package io.bilevel.cli;

import io.bilevel.core.Capacity;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line front end: groups delimited rows by one set of columns and
 * prints the distinct values of another set of columns for each group.
 *
 * Usage:
 *   bilevel --group-cols 0 --key-cols 2 [--input rows.csv] [--delimiter ,]
 *           [--count | --pivot] [--capacity-config capacity.json]
 *
 * Examples:
 *   bilevel -g 0 -k 1 -i visits.csv
 *   cat visits.csv | bilevel -g 0 -k 1,2 --count
 *
 * Exit codes: 0 success, 1 usage or configuration error, 2 I/O failure.
 */
public final class Cli {

    private Cli() {
    }

    public static void main(String[] args) {
        try {
            CliConfig config = parseArgs(args);
            if (config.help()) {
                System.out.println(CliConfig.usage());
                return;
            }
            Capacity capacity = loadCapacity(config);

            long start = System.nanoTime();
            GroupingRunner.Summary summary;
            try (BufferedReader in = open(config)) {
                Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
                summary = new GroupingRunner(config, capacity).run(in, out);
            }
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RunLogger.logRun(summary, totalMs);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (IOException | UncheckedIOException e) {
            RunLogger.logFailure("I/O failure", e);
            System.err.println("error: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static CliConfig parseArgs(String[] args) {
        try {
            return CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
            throw new IllegalStateException("unreachable");
        }
    }

    private static Capacity loadCapacity(CliConfig config) {
        if (config.capacityConfigPath() == null) {
            return Capacity.none();
        }
        try {
            return CapacityConfig.fromJsonFile(Path.of(config.capacityConfigPath()));
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new CliException(e.getMessage()
                    + (e.getCause() != null ? ": " + e.getCause().getMessage() : ""));
        }
    }

    private static BufferedReader open(CliConfig config) throws IOException {
        if (config.input() == null) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        Path input = Path.of(config.input());
        if (!Files.isReadable(input)) {
            throw new CliException("cannot read input file: " + input);
        }
        return Files.newBufferedReader(input, StandardCharsets.UTF_8);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println(CliConfig.usage());
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
