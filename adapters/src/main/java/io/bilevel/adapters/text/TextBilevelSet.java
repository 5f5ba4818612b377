package io.bilevel.adapters.text;

import io.bilevel.core.BilevelSet;
import io.bilevel.core.Capacity;
import io.bilevel.core.Pair;

import java.util.Iterator;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

import static io.bilevel.adapters.text.TextWidths.requirePositive;
import static io.bilevel.adapters.text.TextWidths.requireWidth;

/**
 * A {@link BilevelSet} whose group and aggregation keys are fixed-width
 * arrays of strings.
 * <p>
 * Callers pass plain {@code CharSequence[]}; a {@link TextKey} is only
 * built the first time a group or key is seen.
 */
public final class TextBilevelSet implements Iterable<Pair<TextKey, TextKey>> {

    private final int groupWidth;
    private final int keyWidth;
    private final BilevelSet<TextKey, TextKey> set;
    private final BilevelSet<TextKey, TextKey>.Lookup<CharSequence[], CharSequence[]> lookup;

    public TextBilevelSet(int groupWidth, int keyWidth) {
        this(groupWidth, keyWidth, Capacity.none());
    }

    public TextBilevelSet(int groupWidth, int keyWidth, Capacity capacity) {
        this(requirePositive(groupWidth, "group"), requirePositive(keyWidth, "key"),
                BilevelSet.withCapacity(capacity));
    }

    private TextBilevelSet(int groupWidth, int keyWidth, BilevelSet<TextKey, TextKey> set) {
        this.groupWidth = groupWidth;
        this.keyWidth = keyWidth;
        this.set = set;
        this.lookup = set.using(TextKey.lookupForm(), TextKey.lookupForm());
    }

    /**
     * Insert a pair.
     *
     * @return true if the pair is new, false if it was already present
     * @throws IllegalArgumentException if either array has the wrong width
     */
    public boolean insert(CharSequence[] g, CharSequence[] k) {
        return lookup.insert(requireWidth(g, groupWidth, "group key"), requireWidth(k, keyWidth, "key"));
    }

    public boolean contains(CharSequence[] g, CharSequence[] k) {
        return lookup.contains(requireWidth(g, groupWidth, "group key"), requireWidth(k, keyWidth, "key"));
    }

    /** Same pairs grouped by the aggregation key. */
    public TextBilevelSet pivot() {
        return new TextBilevelSet(keyWidth, groupWidth, set.pivot());
    }

    @Override
    public Iterator<Pair<TextKey, TextKey>> iterator() {
        return set.iterator();
    }

    public Stream<Pair<TextKey, TextKey>> stream() {
        return set.stream();
    }

    public void forEachPair(BiConsumer<? super TextKey, ? super TextKey> action) {
        set.forEachPair(action);
    }

    public int groupWidth() {
        return groupWidth;
    }

    public int keyWidth() {
        return keyWidth;
    }

    public int size() {
        return set.size();
    }

    public int groupCount() {
        return set.groupCount();
    }

    public int keyCount() {
        return set.keyCount();
    }

    @Override
    public String toString() {
        return set.toString();
    }
}
