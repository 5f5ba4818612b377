package io.bilevel.adapters.text;

import io.bilevel.core.KeyForm;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable fixed-width tuple of strings, used as a group or aggregation key.
 * <p>
 * {@link #hashCode()} is computed exactly like the hash of the
 * {@code CharSequence[]} lookup form (see {@link #lookupForm()}), so a caller's
 * array of CharSequences can be looked up without building a TextKey first.
 */
public final class TextKey {

    private static final KeyForm<CharSequence[], TextKey> LOOKUP = new KeyForm<>() {
        @Override public int hash(CharSequence[] ref) { return hashOf(ref); }
        @Override public boolean matches(CharSequence[] ref, TextKey key) { return key.matches(ref); }
        @Override public TextKey own(CharSequence[] ref) { return of(ref); }
    };

    private final String[] parts;
    private final int hash;

    private TextKey(String[] parts) {
        this.parts = parts;
        this.hash = hashOf(parts);
    }

    /** Copy the given parts into a new key. Null parts are rejected. */
    public static TextKey of(CharSequence... parts) {
        Objects.requireNonNull(parts, "parts");
        String[] owned = new String[parts.length];
        for (int i = 0; i < parts.length; i++) {
            owned[i] = Objects.requireNonNull(parts[i], "part " + i).toString();
        }
        return new TextKey(owned);
    }

    /** Form used to look keys up by a {@code CharSequence[]}. */
    public static KeyForm<CharSequence[], TextKey> lookupForm() {
        return LOOKUP;
    }

    public int width() {
        return parts.length;
    }

    public String get(int i) {
        return parts[i];
    }

    public List<String> parts() {
        return List.of(parts);
    }

    public String[] toArray() {
        return parts.clone();
    }

    /** Parts joined with the given delimiter. */
    public String join(CharSequence delimiter) {
        return String.join(delimiter, parts);
    }

    boolean matches(CharSequence[] ref) {
        if (ref.length != parts.length) return false;
        for (int i = 0; i < parts.length; i++) {
            if (!parts[i].contentEquals(ref[i])) return false;
        }
        return true;
    }

    // Same result as Arrays.hashCode(String[]) for the owned parts.
    static int hashOf(CharSequence[] parts) {
        int h = 1;
        for (int i = 0; i < parts.length; i++) {
            h = 31 * h + KeyForm.stringHash(Objects.requireNonNull(parts[i], "part " + i));
        }
        return h;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextKey other)) return false;
        return hash == other.hash && Arrays.equals(parts, other.parts);
    }

    @Override public int hashCode() { return hash; }

    @Override public String toString() { return Arrays.toString(parts); }
}
