package io.bilevel.core;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

/**
 * Lookup form R of an owned key type T.
 * <p>
 * A key form tells the interning tables how to:
 *  - hash a reference without owning it,
 *  - compare a reference against a key already stored,
 *  - turn a reference into an owned key when (and only when) it is new.
 * <p>
 * Contract (not checked; a violation leaves the table in an undefined state):
 *  - hash(ref) == own(ref).hashCode()
 *  - matches(ref, key) == own(ref).equals(key)
 * <p>
 * The three ownership profiles are just different forms:
 *  - {@link #identity()}: cheap keys, stored by reference.
 *  - {@link #copying(UnaryOperator)}: keys copied once, on first insertion.
 *  - borrowed forms ({@link #chars()}, {@link #of}): lookups by a different
 *    type, owned copy produced on first insertion only.
 *
 * @param <R> reference type passed by callers
 * @param <T> owned type kept in the table
 */
public interface KeyForm<R, T> {

    /** Hash of the reference, identical to the hashCode of its owned form. */
    int hash(R ref);

    /** True if the reference denotes the stored key. */
    boolean matches(R ref, T key);

    /** Produce the owned key. Called once per distinct key. */
    T own(R ref);

    /** Keys are stored as given and compared with hashCode/equals. */
    static <T> KeyForm<T, T> identity() {
        return new KeyForm<>() {
            @Override public int hash(T ref) { return ref.hashCode(); }
            @Override public boolean matches(T ref, T key) { return ref.equals(key); }
            @Override public T own(T ref) { return ref; }
        };
    }

    /**
     * Keys are compared with hashCode/equals, and copied with {@code copier}
     * the first time they are stored. A lookup hit never copies.
     */
    static <T> KeyForm<T, T> copying(UnaryOperator<T> copier) {
        Objects.requireNonNull(copier, "copier");
        return new KeyForm<>() {
            @Override public int hash(T ref) { return ref.hashCode(); }
            @Override public boolean matches(T ref, T key) { return ref.equals(key); }
            @Override public T own(T ref) { return copier.apply(ref); }
        };
    }

    /**
     * String keys looked up by any CharSequence (StringBuilder, CharBuffer, ...).
     * toString() is only called for keys not seen before.
     */
    static KeyForm<CharSequence, String> chars() {
        return Chars.INSTANCE;
    }

    /** Build a form from its three functions. */
    static <R, T> KeyForm<R, T> of(
            ToIntFunction<? super R> hash,
            BiPredicate<? super R, ? super T> matches,
            Function<? super R, ? extends T> own
    ) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(matches, "matches");
        Objects.requireNonNull(own, "own");
        return new KeyForm<>() {
            @Override public int hash(R ref) { return hash.applyAsInt(ref); }
            @Override public boolean matches(R ref, T key) { return matches.test(ref, key); }
            @Override public T own(R ref) { return own.apply(ref); }
        };
    }

    /**
     * Same hash as {@link String#hashCode()} computed over any CharSequence.
     */
    static int stringHash(CharSequence cs) {
        if (cs instanceof String s) {
            return s.hashCode();
        }
        int h = 0;
        for (int i = 0, n = cs.length(); i < n; i++) {
            h = 31 * h + cs.charAt(i);
        }
        return h;
    }

    final class Chars implements KeyForm<CharSequence, String> {
        static final Chars INSTANCE = new Chars();

        private Chars() {
        }

        @Override public int hash(CharSequence ref) { return stringHash(ref); }
        @Override public boolean matches(CharSequence ref, String key) { return key.contentEquals(ref); }
        @Override public String own(CharSequence ref) { return ref.toString(); }
    }
}
