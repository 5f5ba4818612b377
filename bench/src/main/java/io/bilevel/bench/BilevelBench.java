package io.bilevel.bench;

import io.bilevel.adapters.scalar.LongBilevelSet;
import io.bilevel.core.BilevelSet;
import io.bilevel.core.Capacity;
import io.bilevel.core.KeyForm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Insert throughput of the key ownership profiles on one Zipfian workload.
 *
 * Usage:
 *   java -jar bench.jar \
 *     --pairs 1000000 \
 *     --groups 10000 \
 *     --keys 100000 \
 *     --zipf-skew 0.99 \
 *     --rounds 3 \
 *     --presize false
 *
 * Output:
 *   - Summary line per profile to stderr.
 *   - CSV to stdout, one row per profile and round:
 *       profile,pairs,distinct,millis
 */
public final class BilevelBench {

    enum Profile {
        /** Pre-built String keys stored as given. */
        IDENTITY("identity"),
        /** Pre-built String keys, copied when first stored. */
        COPIED("copied"),
        /** Keys formatted into reused StringBuilders, owned copies made on first sight. */
        BORROWED("borrowed"),
        /** Raw ids through the long adapter. */
        SCALAR("scalar");

        final String label;

        Profile(String label) {
            this.label = label;
        }
    }

    /** Pre-generated pairs, shared by every profile. */
    record Workload(int[] groupIds, int[] keyIds, String[] groupNames, String[] keyNames, Capacity capacity) {

        static Workload generate(int pairs, int groups, int keys, double skew, long seed, boolean presize) {
            int[] groupIds = new int[pairs];
            int[] keyIds = new int[pairs];
            new ZipfianPairGenerator(groups, keys, skew, seed).fill(groupIds, keyIds);

            String[] groupNames = new String[groups];
            for (int i = 0; i < groups; i++) groupNames[i] = groupName(i);
            String[] keyNames = new String[keys];
            for (int i = 0; i < keys; i++) keyNames[i] = keyName(i);

            Capacity capacity = presize ? new Capacity(groups, Capacity.DEFAULT_PER_GROUP, keys) : Capacity.none();
            return new Workload(groupIds, keyIds, groupNames, keyNames, capacity);
        }

        int pairs() {
            return groupIds.length;
        }
    }

    record Result(Profile profile, int pairs, int distinct, double millis) {}

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int pairs = Integer.parseInt(cfg.getOrDefault("pairs", "1000000"));
        int groups = Integer.parseInt(cfg.getOrDefault("groups", "10000"));
        int keys = Integer.parseInt(cfg.getOrDefault("keys", "100000"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        int rounds = Integer.parseInt(cfg.getOrDefault("rounds", "3"));
        boolean presize = Boolean.parseBoolean(cfg.getOrDefault("presize", "false"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));

        Workload workload = Workload.generate(pairs, groups, keys, zipfSkew, seed, presize);

        List<Result> all = new ArrayList<>();
        for (Profile profile : Profile.values()) {
            for (int r = 0; r < rounds; r++) {
                all.add(run(profile, workload));
            }
        }
        summarizeAndPrint(all);
    }

    static Result run(Profile profile, Workload w) {
        long start = System.nanoTime();
        int distinct = switch (profile) {
            case IDENTITY -> runIdentity(w);
            case COPIED -> runCopied(w);
            case BORROWED -> runBorrowed(w);
            case SCALAR -> runScalar(w);
        };
        double millis = (System.nanoTime() - start) / 1_000_000.0;
        return new Result(profile, w.pairs(), distinct, millis);
    }

    private static int runIdentity(Workload w) {
        BilevelSet<String, String> set = BilevelSet.withCapacity(w.capacity());
        for (int i = 0; i < w.pairs(); i++) {
            set.insert(w.groupNames()[w.groupIds()[i]], w.keyNames()[w.keyIds()[i]]);
        }
        return set.size();
    }

    private static int runCopied(Workload w) {
        BilevelSet<String, String> set = BilevelSet.<String, String>builder()
                .groupForm(KeyForm.copying(String::new))
                .keyForm(KeyForm.copying(String::new))
                .capacity(w.capacity())
                .build();
        for (int i = 0; i < w.pairs(); i++) {
            set.insert(w.groupNames()[w.groupIds()[i]], w.keyNames()[w.keyIds()[i]]);
        }
        return set.size();
    }

    private static int runBorrowed(Workload w) {
        BilevelSet<String, String> set = BilevelSet.withCapacity(w.capacity());
        var lookup = set.using(KeyForm.chars(), KeyForm.chars());
        var g = new StringBuilder();
        var k = new StringBuilder();
        for (int i = 0; i < w.pairs(); i++) {
            g.setLength(0);
            k.setLength(0);
            lookup.insert(g.append("g-").append(w.groupIds()[i]), k.append("k-").append(w.keyIds()[i]));
        }
        return set.size();
    }

    private static int runScalar(Workload w) {
        var set = new LongBilevelSet(w.capacity());
        for (int i = 0; i < w.pairs(); i++) {
            set.insert(w.groupIds()[i], w.keyIds()[i]);
        }
        return set.size();
    }

    static String groupName(int id) {
        return "g-" + id;
    }

    static String keyName(int id) {
        return "k-" + id;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void summarizeAndPrint(List<Result> all) {
        if (all.isEmpty()) {
            System.err.println("no rounds run");
            return;
        }

        for (Profile profile : Profile.values()) {
            double best = Double.MAX_VALUE;
            double total = 0.0;
            int n = 0;
            int distinct = -1;
            int pairs = 0;
            for (Result r : all) {
                if (r.profile() != profile) continue;
                best = Math.min(best, r.millis());
                total += r.millis();
                distinct = r.distinct();
                pairs = r.pairs();
                n++;
            }
            if (n == 0) continue;
            System.err.printf(
                    "%-8s pairs=%d, distinct=%d, best=%.2fms, mean=%.2fms, throughput=%.0f pairs/s%n",
                    profile.label, pairs, distinct, best, total / n, pairs / (best / 1000.0)
            );
        }

        // CSV to stdout.
        System.out.println("profile,pairs,distinct,millis");
        for (Result r : all) {
            System.out.printf("%s,%d,%d,%.3f%n", r.profile().label, r.pairs(), r.distinct(), r.millis());
        }
    }
}
