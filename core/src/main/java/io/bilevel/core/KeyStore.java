package io.bilevel.core;

import it.unimi.dsi.fastutil.HashCommon;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;

/**
 * Interning store: keeps one owned copy of each distinct key and refers to it
 * by a dense integer index.
 * <p>
 * Layout:
 *  - key arena:   append-only list of owned keys, in first-seen order.
 *                 A key's position in the arena is its index.
 *  - hash cache:  parallel list with the hash of each arena key, so probing
 *                 and rehashing never call hashCode() again.
 *  - dedup index: open-addressed table (linear probing) of arena positions,
 *                 stored as index + 1 so that 0 marks an empty slot.
 * <p>
 * Guarantees:
 *  - Each distinct key occupies exactly one arena slot for the lifetime of the store.
 *  - Indices are 0..size()-1, assigned in first-seen order, never reused.
 *  - {@link KeyForm#own} is only called on a miss; a hit allocates nothing.
 * <p>
 * Not thread safe.
 */
public final class KeyStore<T> {

    private static final float LOAD_FACTOR = 0.75f;

    private final ObjectArrayList<T> arena;
    private final IntArrayList hashes;

    private int[] slots;
    private int mask;
    private int maxFill;

    public KeyStore() {
        this(0);
    }

    /**
     * @param expected number of distinct keys to pre-size for
     */
    public KeyStore(int expected) {
        if (expected < 0) throw new IllegalArgumentException("expected must be >= 0, got: " + expected);
        this.arena = new ObjectArrayList<>(expected);
        this.hashes = new IntArrayList(expected);
        allocate(HashCommon.arraySize(expected, LOAD_FACTOR));
    }

    /**
     * Return the index of the key denoted by {@code ref}, interning an owned
     * copy first if the key has not been seen before.
     */
    public <R> int resolve(KeyForm<R, T> form, R ref) {
        Objects.requireNonNull(ref, "key");
        int h = form.hash(ref);
        int pos = HashCommon.mix(h) & mask;
        int s;
        while ((s = slots[pos]) != 0) {
            int idx = s - 1;
            if (hashes.getInt(idx) == h && form.matches(ref, arena.get(idx))) {
                return idx;
            }
            pos = (pos + 1) & mask;
        }

        // Miss: this is the only place new key storage is created.
        int idx = arena.size();
        arena.add(Objects.requireNonNull(form.own(ref), "own() returned null"));
        hashes.add(h);
        slots[pos] = idx + 1;
        if (arena.size() > maxFill) {
            rehash(slots.length << 1);
        }
        return idx;
    }

    /**
     * Return the index of the key denoted by {@code ref}, or -1 if it has not
     * been interned. Never modifies the store.
     */
    public <R> int find(KeyForm<R, T> form, R ref) {
        Objects.requireNonNull(ref, "key");
        int h = form.hash(ref);
        int pos = HashCommon.mix(h) & mask;
        int s;
        while ((s = slots[pos]) != 0) {
            int idx = s - 1;
            if (hashes.getInt(idx) == h && form.matches(ref, arena.get(idx))) {
                return idx;
            }
            pos = (pos + 1) & mask;
        }
        return -1;
    }

    /** Owned key at {@code index}. */
    public T key(int index) {
        return arena.get(index);
    }

    /** Number of distinct keys interned so far. */
    public int size() {
        return arena.size();
    }

    /** Read-only view of the arena, in index order. */
    public List<T> keys() {
        return new AbstractList<>() {
            @Override public T get(int index) { return arena.get(index); }
            @Override public int size() { return arena.size(); }
        };
    }

    private void allocate(int tableSize) {
        this.slots = new int[tableSize];
        this.mask = tableSize - 1;
        this.maxFill = HashCommon.maxFill(tableSize, LOAD_FACTOR);
    }

    private void rehash(int tableSize) {
        allocate(tableSize);
        for (int idx = 0, n = arena.size(); idx < n; idx++) {
            int pos = HashCommon.mix(hashes.getInt(idx)) & mask;
            while (slots[pos] != 0) {
                pos = (pos + 1) & mask;
            }
            slots[pos] = idx + 1;
        }
    }
}
