package io.bilevel.cli;

import io.bilevel.adapters.text.TextBilevelMap;
import io.bilevel.adapters.text.TextBilevelSet;
import io.bilevel.adapters.text.TextKey;
import io.bilevel.core.BilevelMap;
import io.bilevel.core.Capacity;
import io.bilevel.core.Pair;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads delimited rows, collects the distinct (group columns, key columns)
 * pairs and writes them out grouped.
 * <p>
 * Output is one line per pair: {@code g1<d>g2<TAB>k1<d>k2}, followed by
 * {@code <TAB>count} in counting mode. Rows with fewer columns than the
 * highest selected column are skipped.
 */
public final class GroupingRunner {

    /** Totals for one run. */
    public record Summary(long rows, long skipped, int pairs, int groups, int keys) {}

    private final CliConfig config;
    private final Capacity capacity;
    private final Pattern splitter;
    private final int requiredColumns;

    public GroupingRunner(CliConfig config, Capacity capacity) {
        this.config = Objects.requireNonNull(config, "config");
        this.capacity = Objects.requireNonNull(capacity, "capacity");
        this.splitter = Pattern.compile(Pattern.quote(config.delimiter()));
        this.requiredColumns = config.maxColumn() + 1;
    }

    public Summary run(BufferedReader in, Writer out) throws IOException {
        return config.count() ? runCounting(in, out) : runDistinct(in, out);
    }

    private Summary runDistinct(BufferedReader in, Writer out) throws IOException {
        var set = new TextBilevelSet(config.groupCols().size(), config.keyCols().size(), capacity);
        long[] totals = new long[2];
        readRows(in, totals, (g, k) -> set.insert(g, k));

        TextBilevelSet result = config.pivot() ? set.pivot() : set;
        for (Pair<TextKey, TextKey> p : result) {
            writePair(out, p.group(), p.key());
            out.write('\n');
        }
        out.flush();
        return new Summary(totals[0], totals[1], result.size(), result.groupCount(), result.keyCount());
    }

    private Summary runCounting(BufferedReader in, Writer out) throws IOException {
        var map = new TextBilevelMap<long[]>(
                config.groupCols().size(), config.keyCols().size(), capacity, () -> new long[1]);
        long[] totals = new long[2];
        readRows(in, totals, (g, k) -> map.addOrGet(g, k)[0]++);

        for (BilevelMap.Entry<TextKey, TextKey, long[]> e : map) {
            writePair(out, e.group(), e.key());
            out.write('\t');
            out.write(Long.toString(e.value()[0]));
            out.write('\n');
        }
        out.flush();
        return new Summary(totals[0], totals[1], map.size(), map.groupCount(), map.keyCount());
    }

    // totals[0] = rows read, totals[1] = rows skipped
    private void readRows(BufferedReader in, long[] totals, RowSink sink) throws IOException {
        String[] g = new String[config.groupCols().size()];
        String[] k = new String[config.keyCols().size()];
        long lineNo = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (line.isEmpty()) {
                continue;
            }
            totals[0]++;
            String[] cols = splitter.split(line, -1);
            if (cols.length < requiredColumns) {
                totals[1]++;
                RunLogger.logSkippedRow(lineNo, cols.length, requiredColumns, totals[1]);
                continue;
            }
            select(cols, config.groupCols(), g);
            select(cols, config.keyCols(), k);
            sink.accept(g, k);
        }
    }

    private void writePair(Writer out, TextKey group, TextKey key) throws IOException {
        out.write(group.join(config.delimiter()));
        out.write('\t');
        out.write(key.join(config.delimiter()));
    }

    private static void select(String[] cols, List<Integer> indices, String[] into) {
        for (int i = 0; i < into.length; i++) {
            into[i] = cols[indices.get(i)];
        }
    }

    @FunctionalInterface
    private interface RowSink {
        void accept(String[] group, String[] key);
    }
}
