package io.bilevel.adapters.scalar;

/** One distinct (group, key) pair of scalar keys. */
public record LongPair(long group, long key) {

    public LongPair swap() {
        return new LongPair(key, group);
    }
}
