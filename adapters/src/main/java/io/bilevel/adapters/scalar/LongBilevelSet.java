package io.bilevel.adapters.scalar;

import io.bilevel.core.Capacity;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Distinct (g, k) pairs of {@code long} keys, grouped by g.
 * <p>
 * Scalar keys are cheaper to store than an index, so this variant keeps them
 * directly in primitive hash sets instead of interning them. Results match
 * {@link io.bilevel.core.BilevelSet}: same insert results, same grouping.
 */
public final class LongBilevelSet implements Iterable<LongPair> {

    /** Receives each pair during {@link #forEachPair}. */
    @FunctionalInterface
    public interface PairConsumer {
        void accept(long group, long key);
    }

    private final Long2ObjectOpenHashMap<LongOpenHashSet> data;
    private final int perGroup;
    private int size;
    private int modCount;

    public LongBilevelSet() {
        this(Capacity.none());
    }

    /** Uses the group and per-group hints; aggregation keys are not interned here. */
    public LongBilevelSet(Capacity capacity) {
        this.data = new Long2ObjectOpenHashMap<>(capacity.groups());
        this.perGroup = capacity.perGroup();
    }

    /**
     * @return true if the pair is new, false if it was already present
     */
    public boolean insert(long g, long k) {
        LongOpenHashSet keys = data.get(g);
        if (keys == null) {
            keys = new LongOpenHashSet(perGroup);
            data.put(g, keys);
        }
        if (!keys.add(k)) {
            return false;
        }
        size++;
        modCount++;
        return true;
    }

    public boolean contains(long g, long k) {
        LongOpenHashSet keys = data.get(g);
        return keys != null && keys.contains(k);
    }

    /** Same pairs grouped by the aggregation key. */
    public LongBilevelSet pivot() {
        var pivoted = new LongBilevelSet(new Capacity(distinctKeys(), perGroup, data.size()));
        forEachPair((g, k) -> pivoted.insert(k, g));
        return pivoted;
    }

    public void forEachPair(PairConsumer action) {
        int expected = modCount;
        for (ObjectIterator<Long2ObjectMap.Entry<LongOpenHashSet>> it = Long2ObjectMaps.fastIterator(data); it.hasNext(); ) {
            Long2ObjectMap.Entry<LongOpenHashSet> e = it.next();
            long g = e.getLongKey();
            for (LongIterator keys = e.getValue().iterator(); keys.hasNext(); ) {
                action.accept(g, keys.nextLong());
            }
            if (modCount != expected) {
                throw new ConcurrentModificationException();
            }
        }
    }

    @Override
    public Iterator<LongPair> iterator() {
        return new Iterator<>() {
            private final int expected = modCount;
            private final ObjectIterator<Long2ObjectMap.Entry<LongOpenHashSet>> outer = Long2ObjectMaps.fastIterator(data);
            private long group;
            private LongIterator inner;

            @Override
            public boolean hasNext() {
                if (modCount != expected) {
                    throw new ConcurrentModificationException();
                }
                while (inner == null || !inner.hasNext()) {
                    if (!outer.hasNext()) {
                        return false;
                    }
                    Long2ObjectMap.Entry<LongOpenHashSet> e = outer.next();
                    group = e.getLongKey();
                    inner = e.getValue().iterator();
                }
                return true;
            }

            @Override
            public LongPair next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new LongPair(group, inner.nextLong());
            }
        };
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int groupCount() {
        return data.size();
    }

    private int distinctKeys() {
        var keys = new LongOpenHashSet();
        for (LongOpenHashSet group : data.values()) {
            keys.addAll(group);
        }
        return keys.size();
    }
}
