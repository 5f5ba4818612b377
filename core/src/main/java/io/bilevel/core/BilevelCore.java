package io.bilevel.core;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * State shared by {@link BilevelSet} and {@link BilevelMap}: the aggregation
 * key store, the group table, and the bookkeeping used by fail-fast iterators.
 * <p>
 * Aggregation keys live only in {@link #keys}; group containers refer to them
 * by index, so a key that appears in many groups is stored once.
 */
abstract class BilevelCore<G, K, C> {

    final Capacity capacity;
    final KeyForm<G, G> groupForm;
    final KeyForm<K, K> keyForm;
    private final IntFunction<? extends C> containerFactory;

    KeyStore<K> keys;
    GroupTable<G, C> groups;

    // Number of distinct (g, k) pairs.
    int size;

    // Bumped on every structural change; checked by iterators.
    int modCount;

    BilevelCore(
            Capacity capacity,
            KeyForm<G, G> groupForm,
            KeyForm<K, K> keyForm,
            IntFunction<? extends C> containerFactory
    ) {
        this.capacity = Objects.requireNonNull(capacity, "capacity");
        this.groupForm = Objects.requireNonNull(groupForm, "groupForm");
        this.keyForm = Objects.requireNonNull(keyForm, "keyForm");
        this.containerFactory = containerFactory;
        reset();
    }

    /** Drop all contents, keeping the original capacity hints. */
    final void reset() {
        this.keys = new KeyStore<>(capacity.aggKeys());
        this.groups = new GroupTable<>(capacity.groups(), capacity.perGroup(), containerFactory);
        this.size = 0;
    }

    /** Number of distinct (group, key) pairs. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Number of distinct group keys. */
    public int groupCount() {
        return groups.size();
    }

    /** Number of distinct aggregation keys, across all groups. */
    public int keyCount() {
        return keys.size();
    }

    /** Size hints this collection was created with. */
    public Capacity capacity() {
        return capacity;
    }

    static void requireKeys(Object g, Object k) {
        Objects.requireNonNull(g, "group key");
        Objects.requireNonNull(k, "aggregation key");
    }
}
