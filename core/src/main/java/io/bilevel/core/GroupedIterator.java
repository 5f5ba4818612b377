package io.bilevel.core;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.IntSupplier;

/**
 * Walks a {@link GroupTable} one group at a time: every element of a group's
 * container is returned before the next group is opened, so a group key
 * never reappears once the iteration has moved past it.
 * <p>
 * Fail-fast: if the owning collection is modified after the iterator was
 * created, the next call throws {@link ConcurrentModificationException}.
 *
 * @param <G> group key type
 * @param <C> per-group container type
 * @param <E> element type returned to callers
 */
abstract class GroupedIterator<G, C, E> implements Iterator<E> {

    private final GroupTable<G, C> table;
    private final IntSupplier modCount;
    private final int expectedModCount;

    private int nextGroup;
    private G group;
    private boolean opened;

    GroupedIterator(GroupTable<G, C> table, IntSupplier modCount) {
        this.table = table;
        this.modCount = modCount;
        this.expectedModCount = modCount.getAsInt();
    }

    /** Start iterating the container of a newly opened group. */
    protected abstract void open(C container);

    /** True if the currently open container has more elements. */
    protected abstract boolean innerHasNext();

    /** Next element of the currently open container. */
    protected abstract E innerNext(G group);

    @Override
    public final boolean hasNext() {
        if (modCount.getAsInt() != expectedModCount) {
            throw new ConcurrentModificationException();
        }
        while (!opened || !innerHasNext()) {
            if (nextGroup >= table.size()) {
                return false;
            }
            group = table.group(nextGroup);
            open(table.container(nextGroup));
            opened = true;
            nextGroup++;
        }
        return true;
    }

    @Override
    public final E next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return innerNext(group);
    }
}
