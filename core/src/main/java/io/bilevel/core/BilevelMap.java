package io.bilevel.core;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A collection of distinct pairs (g, k) grouped by g, with a payload kept for
 * each pair.
 * <p>
 * The payload for a pair is created by the payload factory the first time the
 * pair is seen and is kept from then on; {@link #addOrGet} always returns the
 * stored instance, so mutations accumulate across calls. How payloads are
 * combined is up to the caller.
 * <p>
 * There is no pivot: exchanging roles could make two pairs
 * collide, and there is no rule here for merging their payloads.
 * <p>
 * Not thread safe. Iterators are fail-fast.
 *
 * @param <G> group key type
 * @param <K> aggregation key type
 * @param <V> payload type
 */
public final class BilevelMap<G, K, V>
        extends BilevelCore<G, K, Int2ObjectOpenHashMap<V>>
        implements Iterable<BilevelMap.Entry<G, K, V>> {

    /** One (g, k) pair with its stored payload. */
    public record Entry<G, K, V>(G group, K key, V value) {}

    /** Receives each (g, k, payload) triple during {@link #forEachEntry}. */
    @FunctionalInterface
    public interface EntryConsumer<G, K, V> {
        void accept(G group, K key, V value);
    }

    private final Supplier<? extends V> payloadFactory;

    private BilevelMap(
            Capacity capacity,
            KeyForm<G, G> groupForm,
            KeyForm<K, K> keyForm,
            Supplier<? extends V> payloadFactory
    ) {
        super(capacity, groupForm, keyForm, Int2ObjectOpenHashMap::new);
        this.payloadFactory = Objects.requireNonNull(payloadFactory, "payloadFactory");
    }

    /** Empty map: no pre-sizing, keys stored as given. */
    public static <G, K, V> BilevelMap<G, K, V> create(Supplier<? extends V> payloadFactory) {
        return new Builder<G, K, V>(payloadFactory).build();
    }

    /** Empty map pre-sized with the given hints. */
    public static <G, K, V> BilevelMap<G, K, V> withCapacity(Capacity capacity, Supplier<? extends V> payloadFactory) {
        return new Builder<G, K, V>(payloadFactory).capacity(capacity).build();
    }

    public static <G, K, V> Builder<G, K, V> builder(Supplier<? extends V> payloadFactory) {
        return new Builder<>(payloadFactory);
    }

    /**
     * Stored payload for the pair, created with the payload factory if the
     * pair is new.
     */
    public V addOrGet(G g, K k) {
        return addOrGet(groupForm, g, keyForm, k);
    }

    /** Stored payload, or null if the pair is absent. Never creates a payload. */
    public V get(G g, K k) {
        return get(groupForm, g, keyForm, k);
    }

    public boolean contains(G g, K k) {
        return get(g, k) != null;
    }

    /**
     * View that accepts lookup forms of the keys. Owned copies are made only
     * for a group or key seen for the first time.
     */
    public <GR, KR> Lookup<GR, KR> using(KeyForm<GR, G> groupLookup, KeyForm<KR, K> keyLookup) {
        return new Lookup<>(groupLookup, keyLookup);
    }

    /** Entries grouped by group key. Does not consume the map. */
    @Override
    public Iterator<Entry<G, K, V>> iterator() {
        return new EntryIterator<>(groups, keys, () -> modCount);
    }

    /**
     * Consuming iteration: the returned iterator takes over the current
     * contents and this map is left empty, with its original capacity hints.
     */
    public Iterator<Entry<G, K, V>> drain() {
        var detached = new EntryIterator<>(groups, keys, () -> 0);
        reset();
        modCount++;
        return detached;
    }

    public Stream<Entry<G, K, V>> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size,
                        Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.SIZED),
                false);
    }

    /** Grouped iteration without allocating an entry per element. */
    public void forEachEntry(EntryConsumer<? super G, ? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        int expected = modCount;
        for (int g = 0, n = groups.size(); g < n; g++) {
            G group = groups.group(g);
            for (var it = Int2ObjectMaps.fastIterator(groups.container(g)); it.hasNext(); ) {
                Int2ObjectMap.Entry<V> e = it.next();
                action.accept(group, keys.key(e.getIntKey()), e.getValue());
            }
            if (modCount != expected) {
                throw new ConcurrentModificationException();
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int g = 0, n = groups.size(); g < n; g++) {
            if (g > 0) sb.append(", ");
            sb.append(groups.group(g)).append("={");
            boolean first = true;
            for (var it = Int2ObjectMaps.fastIterator(groups.container(g)); it.hasNext(); ) {
                Int2ObjectMap.Entry<V> e = it.next();
                if (!first) sb.append(", ");
                sb.append(keys.key(e.getIntKey())).append('=').append(e.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.append('}').toString();
    }

    private <GR, KR> V addOrGet(KeyForm<GR, G> gf, GR g, KeyForm<KR, K> kf, KR k) {
        requireKeys(g, k);
        int ki = keys.find(kf, k);
        Int2ObjectOpenHashMap<V> payloads = groups.find(gf, g);
        if (ki >= 0 && payloads != null) {
            V v = payloads.get(ki);
            if (v != null) {
                return v;
            }
        }
        // Nothing is stored until the factory has produced the payload.
        V v = newPayload();
        if (ki < 0) ki = keys.resolve(kf, k);
        if (payloads == null) payloads = groups.getOrCreate(gf, g);
        payloads.put(ki, v);
        size++;
        modCount++;
        return v;
    }

    private <GR, KR> V get(KeyForm<GR, G> gf, GR g, KeyForm<KR, K> kf, KR k) {
        requireKeys(g, k);
        int ki = keys.find(kf, k);
        if (ki < 0) {
            return null;
        }
        Int2ObjectOpenHashMap<V> payloads = groups.find(gf, g);
        return payloads == null ? null : payloads.get(ki);
    }

    private V newPayload() {
        return Objects.requireNonNull(payloadFactory.get(), "payload factory returned null");
    }

    /**
     * addOrGet/get through lookup forms of the keys.
     *
     * @param <GR> group key lookup type
     * @param <KR> aggregation key lookup type
     */
    public final class Lookup<GR, KR> {
        private final KeyForm<GR, G> groupLookup;
        private final KeyForm<KR, K> keyLookup;

        private Lookup(KeyForm<GR, G> groupLookup, KeyForm<KR, K> keyLookup) {
            this.groupLookup = Objects.requireNonNull(groupLookup, "groupLookup");
            this.keyLookup = Objects.requireNonNull(keyLookup, "keyLookup");
        }

        public V addOrGet(GR g, KR k) {
            return BilevelMap.this.addOrGet(groupLookup, g, keyLookup, k);
        }

        public V get(GR g, KR k) {
            return BilevelMap.this.get(groupLookup, g, keyLookup, k);
        }
    }

    /**
     * Builder for maps with non-default key forms or size hints.
     */
    public static final class Builder<G, K, V> {
        private final Supplier<? extends V> payloadFactory;
        private KeyForm<G, G> groupForm = KeyForm.identity();
        private KeyForm<K, K> keyForm = KeyForm.identity();
        private Capacity capacity = Capacity.none();

        private Builder(Supplier<? extends V> payloadFactory) {
            this.payloadFactory = Objects.requireNonNull(payloadFactory, "payloadFactory");
        }

        public Builder<G, K, V> groupForm(KeyForm<G, G> groupForm) {
            this.groupForm = Objects.requireNonNull(groupForm, "groupForm");
            return this;
        }

        public Builder<G, K, V> keyForm(KeyForm<K, K> keyForm) {
            this.keyForm = Objects.requireNonNull(keyForm, "keyForm");
            return this;
        }

        public Builder<G, K, V> capacity(Capacity capacity) {
            this.capacity = Objects.requireNonNull(capacity, "capacity");
            return this;
        }

        public BilevelMap<G, K, V> build() {
            return new BilevelMap<>(capacity, groupForm, keyForm, payloadFactory);
        }
    }

    private static final class EntryIterator<G, K, V>
            extends GroupedIterator<G, Int2ObjectOpenHashMap<V>, Entry<G, K, V>> {
        private final KeyStore<K> keys;
        private ObjectIterator<Int2ObjectMap.Entry<V>> inner;

        EntryIterator(GroupTable<G, Int2ObjectOpenHashMap<V>> groups, KeyStore<K> keys, IntSupplier modCount) {
            super(groups, modCount);
            this.keys = keys;
        }

        @Override
        protected void open(Int2ObjectOpenHashMap<V> container) {
            inner = Int2ObjectMaps.fastIterator(container);
        }

        @Override
        protected boolean innerHasNext() {
            return inner.hasNext();
        }

        @Override
        protected Entry<G, K, V> innerNext(G group) {
            Int2ObjectMap.Entry<V> e = inner.next();
            return new Entry<>(group, keys.key(e.getIntKey()), e.getValue());
        }
    }
}
