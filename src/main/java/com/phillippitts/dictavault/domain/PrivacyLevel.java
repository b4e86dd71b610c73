package com.phillippitts.dictavault.domain;

import java.util.Locale;

/**
 * Binary privacy classification attached to a session id or card id.
 *
 * <p>{@link #PRIVATE} content never leaves the device: no external API calls, no publishing.
 * {@link #PUBLIC} content may be published and sent to external services. An entity with no
 * stored level is {@link #PUBLIC}.
 */
public enum PrivacyLevel {
    PRIVATE,
    PUBLIC;

    /** Level assumed for entities that were never explicitly classified. */
    public static final PrivacyLevel DEFAULT = PUBLIC;

    public String storageValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored value, falling back to {@link #DEFAULT} for null or unknown input.
     */
    public static PrivacyLevel fromStorageValue(String value) {
        if (value == null) {
            return DEFAULT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "private" -> PRIVATE;
            case "public" -> PUBLIC;
            default -> DEFAULT;
        };
    }
}
