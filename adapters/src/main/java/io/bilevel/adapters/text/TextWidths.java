package io.bilevel.adapters.text;

import java.util.Objects;

final class TextWidths {

    private TextWidths() {
        // utility
    }

    static int requirePositive(int width, String what) {
        if (width <= 0) throw new IllegalArgumentException(what + " width must be > 0, got: " + width);
        return width;
    }

    static CharSequence[] requireWidth(CharSequence[] parts, int width, String what) {
        Objects.requireNonNull(parts, what);
        if (parts.length != width) {
            throw new IllegalArgumentException(
                    "%s must have %d parts, got %d".formatted(what, width, parts.length));
        }
        return parts;
    }
}
