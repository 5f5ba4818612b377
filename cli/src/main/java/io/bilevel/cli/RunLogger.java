package io.bilevel.cli;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging for grouping runs.
 *
 * Responsibilities:
 *  - One summary line per run (rows read, rows skipped, pairs, groups, latency).
 *  - A warning per malformed row, capped so a bad file does not flood the log.
 */
public final class RunLogger {
    private static final Logger log = Logger.getLogger(RunLogger.class.getName());

    static final int MAX_ROW_WARNINGS = 20;

    private RunLogger() {
        // utility
    }

    public static void logRun(GroupingRunner.Summary summary, long totalMillis) {
        log.log(Level.INFO, String.format(
                "grouped rows=%d skipped=%d pairs=%d groups=%d keys=%d (total=%dms)",
                summary.rows(),
                summary.skipped(),
                summary.pairs(),
                summary.groups(),
                summary.keys(),
                totalMillis
        ));
    }

    public static void logSkippedRow(long lineNo, int columns, int required, long skippedSoFar) {
        if (skippedSoFar > MAX_ROW_WARNINGS) {
            return;
        }
        String msg = String.format("line %d: %d columns, need %d; row skipped", lineNo, columns, required);
        if (skippedSoFar == MAX_ROW_WARNINGS) {
            msg += " (further skipped rows are not logged)";
        }
        log.log(Level.WARNING, msg);
    }

    public static void logFailure(String what, Throwable error) {
        log.log(Level.SEVERE, what, error);
    }
}
