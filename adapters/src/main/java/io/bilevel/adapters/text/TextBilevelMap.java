package io.bilevel.adapters.text;

import io.bilevel.core.BilevelMap;
import io.bilevel.core.Capacity;

import java.util.Iterator;
import java.util.function.Supplier;

import static io.bilevel.adapters.text.TextWidths.requirePositive;
import static io.bilevel.adapters.text.TextWidths.requireWidth;

/**
 * A {@link BilevelMap} whose group and aggregation keys are fixed-width
 * arrays of strings.
 */
public final class TextBilevelMap<V> implements Iterable<BilevelMap.Entry<TextKey, TextKey, V>> {

    private final int groupWidth;
    private final int keyWidth;
    private final BilevelMap<TextKey, TextKey, V> map;
    private final BilevelMap<TextKey, TextKey, V>.Lookup<CharSequence[], CharSequence[]> lookup;

    public TextBilevelMap(int groupWidth, int keyWidth, Supplier<? extends V> payloadFactory) {
        this(groupWidth, keyWidth, Capacity.none(), payloadFactory);
    }

    public TextBilevelMap(int groupWidth, int keyWidth, Capacity capacity, Supplier<? extends V> payloadFactory) {
        this.groupWidth = requirePositive(groupWidth, "group");
        this.keyWidth = requirePositive(keyWidth, "key");
        this.map = BilevelMap.withCapacity(capacity, payloadFactory);
        this.lookup = map.using(TextKey.lookupForm(), TextKey.lookupForm());
    }

    /** Stored payload for the pair, created if the pair is new. */
    public V addOrGet(CharSequence[] g, CharSequence[] k) {
        return lookup.addOrGet(requireWidth(g, groupWidth, "group key"), requireWidth(k, keyWidth, "key"));
    }

    /** Stored payload, or null if absent. */
    public V get(CharSequence[] g, CharSequence[] k) {
        return lookup.get(requireWidth(g, groupWidth, "group key"), requireWidth(k, keyWidth, "key"));
    }

    @Override
    public Iterator<BilevelMap.Entry<TextKey, TextKey, V>> iterator() {
        return map.iterator();
    }

    public void forEachEntry(BilevelMap.EntryConsumer<? super TextKey, ? super TextKey, ? super V> action) {
        map.forEachEntry(action);
    }

    public int groupWidth() {
        return groupWidth;
    }

    public int keyWidth() {
        return keyWidth;
    }

    public int size() {
        return map.size();
    }

    public int groupCount() {
        return map.groupCount();
    }

    public int keyCount() {
        return map.keyCount();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
