package io.bilevel.bench;

import java.util.Random;

/**
 * Zipfian generator for (group id, key id) pairs, with group ids in
 * [0, groups) and key ids in [0, keys) drawn independently.
 *
 * Precomputes one CDF per axis and samples it with a binary search, so low
 * ids are the hot ones on both axes.
 */
public final class ZipfianPairGenerator {

    private final double[] groupCdf;
    private final double[] keyCdf;
    private final Random rnd;

    public ZipfianPairGenerator(int groups, int keys, double skew, long seed) {
        if (groups <= 0) throw new IllegalArgumentException("groups must be > 0");
        if (keys <= 0) throw new IllegalArgumentException("keys must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.groupCdf = cdf(groups, skew);
        this.keyCdf = cdf(keys, skew);
        this.rnd = new Random(seed);
    }

    public int nextGroup() {
        return sample(groupCdf);
    }

    public int nextKey() {
        return sample(keyCdf);
    }

    /**
     * Fill the two arrays with {@code groupIds.length} pairs.
     */
    public void fill(int[] groupIds, int[] keyIds) {
        if (groupIds.length != keyIds.length) {
            throw new IllegalArgumentException("arrays differ in length: " + groupIds.length + " vs " + keyIds.length);
        }
        for (int i = 0; i < groupIds.length; i++) {
            groupIds[i] = nextGroup();
            keyIds[i] = nextKey();
        }
    }

    private static double[] cdf(int n, double skew) {
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += 1.0 / Math.pow(i + 1, skew);
        }
        double[] cdf = new double[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += (1.0 / Math.pow(i + 1, skew)) / sum;
            cdf[i] = running;
        }
        return cdf;
    }

    private int sample(double[] cdf) {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
