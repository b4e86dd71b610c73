package com.phillippitts.dictavault.domain;

import java.util.Locale;

/**
 * Review status of a persisted {@link PrivacyTag}.
 *
 * <p>Tags start {@link #UNREVIEWED}; only an explicit user review moves them to
 * {@link #ACCEPTED} (the span really is sensitive) or {@link #DISMISSED} (false positive).
 */
public enum TagStatus {
    UNREVIEWED,
    ACCEPTED,
    DISMISSED;

    /**
     * Returns the lowercase value written to storage.
     */
    public String storageValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored value.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static TagStatus fromStorageValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("tag status must not be null");
        }
        return TagStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
