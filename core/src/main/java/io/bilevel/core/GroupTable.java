package io.bilevel.core;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Maps each distinct group key to a per-group container.
 * <p>
 * Group keys are interned in their own {@link KeyStore}, so a group's index
 * doubles as the position of its container. A group key is copied (via its
 * {@link KeyForm}) only the first time the group is seen, never on a hit.
 * <p>
 * Containers are created by the factory with the per-group capacity hint.
 * Groups are never removed.
 *
 * @param <G> owned group key type
 * @param <C> per-group container type (index set or index-to-payload map)
 */
public final class GroupTable<G, C> {

    private final KeyStore<G> groups;
    private final ObjectArrayList<C> containers;
    private final IntFunction<? extends C> factory;
    private final int perGroup;

    public GroupTable(int expectedGroups, int perGroup, IntFunction<? extends C> factory) {
        if (perGroup < 0) throw new IllegalArgumentException("perGroup must be >= 0, got: " + perGroup);
        this.groups = new KeyStore<>(expectedGroups);
        this.containers = new ObjectArrayList<>(expectedGroups);
        this.factory = Objects.requireNonNull(factory, "factory");
        this.perGroup = perGroup;
    }

    /** Container for the group denoted by {@code ref}, created empty if the group is new. */
    public <R> C getOrCreate(KeyForm<R, G> form, R ref) {
        int g = groups.resolve(form, ref);
        if (g == containers.size()) {
            containers.add(factory.apply(perGroup));
        }
        return containers.get(g);
    }

    /** Container for the group denoted by {@code ref}, or null if there is no such group. */
    public <R> C find(KeyForm<R, G> form, R ref) {
        int g = groups.find(form, ref);
        return g < 0 ? null : containers.get(g);
    }

    public G group(int index) {
        return groups.key(index);
    }

    public C container(int index) {
        return containers.get(index);
    }

    /** Number of distinct groups. */
    public int size() {
        return containers.size();
    }
}
