package com.phillippitts.dictavault.domain;

/**
 * Well-known values for {@link Version#versionType()}.
 *
 * <p>The ledger accepts any non-blank type string; these constants cover the types the
 * application writes itself.
 *
 * @since 1.0
 */
public final class VersionTypes {

    /** Transcript as delivered by speech-to-text, before any edit. */
    public static final String RAW = "raw";

    /** Manual edit of the full document. */
    public static final String EDITED = "edited";

    /** Language-model assisted rewrite. */
    public static final String POLISHED = "polished";

    /** Copy of an older version appended by a restore. */
    public static final String RESTORED = "restored";

    private VersionTypes() {
        // Utility class - prevent instantiation
    }
}
