package io.bilevel.core;

/**
 * Size hints for a bilevel collection.
 * <p>
 * These only pre-size internal tables; they never change what a collection
 * stores or returns.
 *
 * @param groups   number of distinct group keys to allocate space for
 * @param perGroup initial capacity of the container created for each new group
 * @param aggKeys  number of distinct aggregation keys to allocate space for
 */
public record Capacity(int groups, int perGroup, int aggKeys) {

    /** Per-group capacity used when no hint is given. */
    public static final int DEFAULT_PER_GROUP = 4;

    private static final Capacity NONE = new Capacity(0, DEFAULT_PER_GROUP, 0);

    public Capacity {
        if (groups < 0) throw new IllegalArgumentException("groups must be >= 0, got: " + groups);
        if (perGroup < 0) throw new IllegalArgumentException("perGroup must be >= 0, got: " + perGroup);
        if (aggKeys < 0) throw new IllegalArgumentException("aggKeys must be >= 0, got: " + aggKeys);
    }

    /** No pre-sizing, default per-group capacity. */
    public static Capacity none() {
        return NONE;
    }
}
