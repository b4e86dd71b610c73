package com.phillippitts.dictavault.domain;

import java.util.Objects;

/**
 * A sensitive span detected in a piece of text.
 *
 * <p>Offsets are UTF-16 indices into the scanned string ({@code String#length()} semantics),
 * with {@code startOffset} inclusive and {@code endOffset} exclusive. Matches are transient:
 * they are produced by a detector and only reach storage as a {@link PrivacyTag}.
 *
 * @param category    detector category, e.g. {@code "Email"}, {@code "Topic:Medical"}, {@code "LLM:Name"}
 * @param text        the matched text as it appears in the input (original casing)
 * @param startOffset inclusive start offset, {@code >= 0}
 * @param endOffset   exclusive end offset, {@code > startOffset}
 * @param approximate {@code true} when the span could not be located in the text and the
 *                    offsets are a fallback; callers must treat such matches as low-confidence
 */
public record Match(
        String category,
        String text,
        int startOffset,
        int endOffset,
        boolean approximate
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if category or text is null
     * @throws IllegalArgumentException if the offsets do not describe a non-empty span
     */
    public Match {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must be >= 0, got: " + startOffset);
        }
        if (endOffset <= startOffset) {
            throw new IllegalArgumentException(
                    "endOffset must be greater than startOffset, got: [" + startOffset + ", " + endOffset + ")");
        }
    }

    /**
     * Creates an exactly located match.
     */
    public static Match of(String category, String text, int startOffset, int endOffset) {
        return new Match(category, text, startOffset, endOffset, false);
    }

    /**
     * Returns the span length in UTF-16 units.
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Checks whether this span lies inside a text of the given length.
     *
     * @param textLength length of the scanned text
     * @return {@code true} if {@code endOffset <= textLength}
     */
    public boolean fitsWithin(int textLength) {
        return endOffset <= textLength;
    }
}
