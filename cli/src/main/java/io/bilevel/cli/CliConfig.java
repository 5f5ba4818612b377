package io.bilevel.cli;

import java.util.Arrays;
import java.util.List;

/**
 * Options for one grouping run, parsed from CLI args.
 *
 * Supports:
 *  - input:              file to read rows from, or null for stdin
 *  - delimiter:          column separator (literal, not a regex)
 *  - groupCols:          zero-based columns forming the group key
 *  - keyCols:            zero-based columns forming the aggregation key
 *  - count:              emit how often each distinct pair occurred
 *  - pivot:              group output by the aggregation key instead
 *  - capacityConfigPath: optional JSON file with table size hints
 *  - help:               only print usage
 */
public record CliConfig(
        String input,
        String delimiter,
        List<Integer> groupCols,
        List<Integer> keyCols,
        boolean count,
        boolean pivot,
        String capacityConfigPath,
        boolean help
) {

    public CliConfig {
        groupCols = List.copyOf(groupCols);
        keyCols = List.copyOf(keyCols);
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --input,      -i  <path>      (default: stdin)
     *   --delimiter,  -d  <text>      (default: ",")
     *   --group-cols, -g  <c1,c2,..>  (required)
     *   --key-cols,   -k  <c1,c2,..>  (required)
     *   --count
     *   --pivot
     *   --capacity-config <path>
     *   --help,       -h
     *
     * @throws IllegalArgumentException on unknown flags, missing values or
     *         an invalid combination of options
     */
    public static CliConfig fromArgs(String[] args) {
        String input = null;
        String delimiter = ",";
        List<Integer> groupCols = null;
        List<Integer> keyCols = null;
        boolean count = false;
        boolean pivot = false;
        String capacityConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(null, ",", List.of(), List.of(), false, false, null, true);
                }
                case "--input", "-i" -> input = value(args, i++);
                case "--delimiter", "-d" -> delimiter = value(args, i++);
                case "--group-cols", "-g" -> groupCols = columns(args[i], value(args, i++));
                case "--key-cols", "-k" -> keyCols = columns(args[i], value(args, i++));
                case "--count" -> count = true;
                case "--pivot" -> pivot = true;
                case "--capacity-config" -> capacityConfigPath = value(args, i++);
                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }

        if (groupCols == null) throw new IllegalArgumentException("--group-cols is required");
        if (keyCols == null) throw new IllegalArgumentException("--key-cols is required");
        if (delimiter.isEmpty()) throw new IllegalArgumentException("--delimiter must not be empty");
        if (count && pivot) {
            throw new IllegalArgumentException("--pivot cannot be combined with --count: pivoting counted pairs has no merge rule");
        }
        return new CliConfig(input, delimiter, groupCols, keyCols, count, pivot, capacityConfigPath, false);
    }

    /** Highest column index a row must have. */
    public int maxColumn() {
        int max = -1;
        for (int c : groupCols) max = Math.max(max, c);
        for (int c : keyCols) max = Math.max(max, c);
        return max;
    }

    static String usage() {
        return """
            Usage: bilevel [options]

            Reads delimited rows and prints each distinct (group, key) pair once,
            grouped by the group columns.

            Options:
              --input,      -i   Input file (default: stdin)
              --delimiter,  -d   Column delimiter (default: ,)
              --group-cols, -g   Zero-based group key columns, e.g. 0,1 (required)
              --key-cols,   -k   Zero-based aggregation key columns, e.g. 2 (required)
              --count            Append how many times each pair occurred
              --pivot            Group the output by the key columns instead
              --capacity-config  JSON file with groups/perGroup/aggKeys size hints
              --help,       -h   Show this help message
            """;
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static List<Integer> columns(String option, String list) {
        try {
            List<Integer> cols = Arrays.stream(list.split(","))
                    .map(String::trim)
                    .map(Integer::valueOf)
                    .toList();
            for (int c : cols) {
                if (c < 0) throw new IllegalArgumentException(option + ": negative column " + c);
            }
            return cols;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + ": invalid column list '" + list + "'", e);
        }
    }
}
