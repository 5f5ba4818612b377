package io.bilevel.core;

/**
 * One distinct (group key, aggregation key) pair.
 */
public record Pair<G, K>(G group, K key) {

    /** Same pair with the roles exchanged. */
    public Pair<K, G> swap() {
        return new Pair<>(key, group);
    }
}
