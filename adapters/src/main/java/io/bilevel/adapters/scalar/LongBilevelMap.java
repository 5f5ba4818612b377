package io.bilevel.adapters.scalar;

import io.bilevel.core.Capacity;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Distinct (g, k) pairs of {@code long} keys grouped by g, with a payload per
 * pair. Scalar counterpart of {@link io.bilevel.core.BilevelMap}.
 */
public final class LongBilevelMap<V> implements Iterable<LongBilevelMap.Entry<V>> {

    public record Entry<V>(long group, long key, V value) {}

    @FunctionalInterface
    public interface EntryConsumer<V> {
        void accept(long group, long key, V value);
    }

    private final Long2ObjectOpenHashMap<Long2ObjectOpenHashMap<V>> data;
    private final int perGroup;
    private final Supplier<? extends V> payloadFactory;
    private int size;
    private int modCount;

    public LongBilevelMap(Supplier<? extends V> payloadFactory) {
        this(Capacity.none(), payloadFactory);
    }

    public LongBilevelMap(Capacity capacity, Supplier<? extends V> payloadFactory) {
        this.data = new Long2ObjectOpenHashMap<>(capacity.groups());
        this.perGroup = capacity.perGroup();
        this.payloadFactory = Objects.requireNonNull(payloadFactory, "payloadFactory");
    }

    /** Stored payload for the pair, created with the factory if the pair is new. */
    public V addOrGet(long g, long k) {
        Long2ObjectOpenHashMap<V> payloads = data.get(g);
        V v = payloads == null ? null : payloads.get(k);
        if (v == null) {
            v = Objects.requireNonNull(payloadFactory.get(), "payload factory returned null");
            group(g).put(k, v);
            size++;
            modCount++;
        }
        return v;
    }

    public V get(long g, long k) {
        Long2ObjectOpenHashMap<V> payloads = data.get(g);
        return payloads == null ? null : payloads.get(k);
    }

    public void forEachEntry(EntryConsumer<? super V> action) {
        int expected = modCount;
        for (var it = Long2ObjectMaps.fastIterator(data); it.hasNext(); ) {
            Long2ObjectMap.Entry<Long2ObjectOpenHashMap<V>> e = it.next();
            long g = e.getLongKey();
            for (var inner = Long2ObjectMaps.fastIterator(e.getValue()); inner.hasNext(); ) {
                Long2ObjectMap.Entry<V> p = inner.next();
                action.accept(g, p.getLongKey(), p.getValue());
            }
            if (modCount != expected) {
                throw new ConcurrentModificationException();
            }
        }
    }

    @Override
    public Iterator<Entry<V>> iterator() {
        return new Iterator<>() {
            private final int expected = modCount;
            private final ObjectIterator<Long2ObjectMap.Entry<Long2ObjectOpenHashMap<V>>> outer =
                    Long2ObjectMaps.fastIterator(data);
            private long group;
            private ObjectIterator<Long2ObjectMap.Entry<V>> inner;

            @Override
            public boolean hasNext() {
                if (modCount != expected) {
                    throw new ConcurrentModificationException();
                }
                while (inner == null || !inner.hasNext()) {
                    if (!outer.hasNext()) {
                        return false;
                    }
                    Long2ObjectMap.Entry<Long2ObjectOpenHashMap<V>> e = outer.next();
                    group = e.getLongKey();
                    inner = Long2ObjectMaps.fastIterator(e.getValue());
                }
                return true;
            }

            @Override
            public Entry<V> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Long2ObjectMap.Entry<V> p = inner.next();
                return new Entry<>(group, p.getLongKey(), p.getValue());
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

    private Long2ObjectOpenHashMap<V> group(long g) {
        Long2ObjectOpenHashMap<V> payloads = data.get(g);
        if (payloads == null) {
            payloads = new Long2ObjectOpenHashMap<>(perGroup);
            data.put(g, payloads);
        }
        return payloads;
    }
}
