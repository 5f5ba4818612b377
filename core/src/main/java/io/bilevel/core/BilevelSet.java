package io.bilevel.core;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.function.IntSupplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A collection of distinct pairs (g, k), grouped by g.
 * <p>
 * As pairs are found they are added if not already present. When the
 * collection is iterated, all pairs of one group are returned before any
 * pair of the next group. The order of groups, and of keys within a group,
 * is unspecified.
 * <p>
 * Storage:
 *  - each distinct aggregation key is interned once in a {@link KeyStore};
 *  - each group holds the set of indices of its aggregation keys.
 * <p>
 * How keys are hashed and copied is decided by the {@link KeyForm}s given to
 * the {@link Builder}; callers holding a different lookup type (for example a
 * StringBuilder for String keys) go through {@link #using}.
 * <p>
 * Not thread safe. Iterators are fail-fast.
 *
 * @param <G> group key type
 * @param <K> aggregation key type
 */
public final class BilevelSet<G, K> extends BilevelCore<G, K, IntOpenHashSet> implements Iterable<Pair<G, K>> {

    private BilevelSet(Capacity capacity, KeyForm<G, G> groupForm, KeyForm<K, K> keyForm) {
        super(capacity, groupForm, keyForm, IntOpenHashSet::new);
    }

    /** Empty set: no pre-sizing, keys stored as given. */
    public static <G, K> BilevelSet<G, K> create() {
        return new Builder<G, K>().build();
    }

    /** Empty set pre-sized with the given hints. */
    public static <G, K> BilevelSet<G, K> withCapacity(Capacity capacity) {
        return new Builder<G, K>().capacity(capacity).build();
    }

    public static <G, K> Builder<G, K> builder() {
        return new Builder<>();
    }

    /**
     * Insert a pair.
     *
     * @return true if the pair was not present before, false if it was
     */
    public boolean insert(G g, K k) {
        return insert(groupForm, g, keyForm, k);
    }

    /** True if the pair is present. Never modifies the set. */
    public boolean contains(G g, K k) {
        return contains(groupForm, g, keyForm, k);
    }

    /**
     * Aggregation keys of one group, in iteration order.
     * Empty if the group is unknown.
     */
    public List<K> keysOf(G g) {
        Objects.requireNonNull(g, "group key");
        IntOpenHashSet members = groups.find(groupForm, g);
        if (members == null) {
            return List.of();
        }
        List<K> out = new ArrayList<>(members.size());
        for (IntIterator it = members.iterator(); it.hasNext(); ) {
            out.add(keys.key(it.nextInt()));
        }
        return List.copyOf(out);
    }

    /**
     * View that accepts lookup forms of the keys. Owned copies are made only
     * for a group or key seen for the first time.
     */
    public <GR, KR> Lookup<GR, KR> using(KeyForm<GR, G> groupLookup, KeyForm<KR, K> keyLookup) {
        return new Lookup<>(groupLookup, keyLookup);
    }

    /**
     * Pairs grouped by group key. Does not consume the set and can be called
     * any number of times.
     */
    @Override
    public Iterator<Pair<G, K>> iterator() {
        return new PairIterator<>(groups, keys, () -> modCount);
    }

    /**
     * Consuming iteration: the returned iterator takes over the current
     * contents and this set is left empty, with its original capacity hints.
     */
    public Iterator<Pair<G, K>> drain() {
        var detached = new PairIterator<>(groups, keys, () -> 0);
        reset();
        modCount++;
        return detached;
    }

    public Stream<Pair<G, K>> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size,
                        Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.SIZED),
                false);
    }

    /** Grouped iteration without allocating a pair per element. */
    public void forEachPair(BiConsumer<? super G, ? super K> action) {
        Objects.requireNonNull(action, "action");
        int expected = modCount;
        for (int g = 0, n = groups.size(); g < n; g++) {
            G group = groups.group(g);
            for (IntIterator it = groups.container(g).iterator(); it.hasNext(); ) {
                action.accept(group, keys.key(it.nextInt()));
            }
            if (modCount != expected) {
                throw new ConcurrentModificationException();
            }
        }
    }

    /**
     * Copy the pairs into a new set that groups by the aggregation key.
     * <p>
     * The new set is sized for this set's key count as its group count (and
     * vice versa), assuming the data is roughly symmetric. Keys go through
     * the same forms as on insertion, so a copying form gives the new set
     * its own copies.
     */
    public BilevelSet<K, G> pivot() {
        var pivoted = new BilevelSet<K, G>(
                new Capacity(keys.size(), capacity.perGroup(), groups.size()),
                keyForm,
                groupForm
        );
        forEachPair((g, k) -> pivoted.insert(k, g));
        return pivoted;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int g = 0, n = groups.size(); g < n; g++) {
            if (g > 0) sb.append(", ");
            sb.append(groups.group(g)).append("=[");
            boolean first = true;
            for (IntIterator it = groups.container(g).iterator(); it.hasNext(); ) {
                if (!first) sb.append(", ");
                sb.append(keys.key(it.nextInt()));
                first = false;
            }
            sb.append(']');
        }
        return sb.append('}').toString();
    }

    private <GR, KR> boolean insert(KeyForm<GR, G> gf, GR g, KeyForm<KR, K> kf, KR k) {
        requireKeys(g, k);
        int ki = keys.resolve(kf, k);
        if (!groups.getOrCreate(gf, g).add(ki)) {
            return false;
        }
        size++;
        modCount++;
        return true;
    }

    private <GR, KR> boolean contains(KeyForm<GR, G> gf, GR g, KeyForm<KR, K> kf, KR k) {
        requireKeys(g, k);
        int ki = keys.find(kf, k);
        if (ki < 0) {
            return false;
        }
        IntOpenHashSet members = groups.find(gf, g);
        return members != null && members.contains(ki);
    }

    /**
     * Insert/contains through lookup forms of the keys.
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

        /** See {@link BilevelSet#insert(Object, Object)}. */
        public boolean insert(GR g, KR k) {
            return BilevelSet.this.insert(groupLookup, g, keyLookup, k);
        }

        public boolean contains(GR g, KR k) {
            return BilevelSet.this.contains(groupLookup, g, keyLookup, k);
        }
    }

    /**
     * Builder for sets with non-default key forms or size hints.
     */
    public static final class Builder<G, K> {
        private KeyForm<G, G> groupForm = KeyForm.identity();
        private KeyForm<K, K> keyForm = KeyForm.identity();
        private Capacity capacity = Capacity.none();

        private Builder() {
        }

        public Builder<G, K> groupForm(KeyForm<G, G> groupForm) {
            this.groupForm = Objects.requireNonNull(groupForm, "groupForm");
            return this;
        }

        public Builder<G, K> keyForm(KeyForm<K, K> keyForm) {
            this.keyForm = Objects.requireNonNull(keyForm, "keyForm");
            return this;
        }

        public Builder<G, K> capacity(Capacity capacity) {
            this.capacity = Objects.requireNonNull(capacity, "capacity");
            return this;
        }

        public BilevelSet<G, K> build() {
            return new BilevelSet<>(capacity, groupForm, keyForm);
        }
    }

    private static final class PairIterator<G, K> extends GroupedIterator<G, IntOpenHashSet, Pair<G, K>> {
        private final KeyStore<K> keys;
        private IntIterator inner;

        PairIterator(GroupTable<G, IntOpenHashSet> groups, KeyStore<K> keys, IntSupplier modCount) {
            super(groups, modCount);
            this.keys = keys;
        }

        @Override
        protected void open(IntOpenHashSet container) {
            inner = container.iterator();
        }

        @Override
        protected boolean innerHasNext() {
            return inner.hasNext();
        }

        @Override
        protected Pair<G, K> innerNext(G group) {
            return new Pair<>(group, keys.key(inner.nextInt()));
        }
    }
}
