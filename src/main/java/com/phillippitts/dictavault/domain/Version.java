package com.phillippitts.dictavault.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable entry in a document's version history.
 *
 * <p>Versions are append-only: for a given {@code documentId} the {@code versionNumber}
 * values run 1, 2, 3, ... with no gaps, and an existing version is never updated or deleted.
 *
 * @param id            unique row id
 * @param documentId    owning document
 * @param versionNumber 1-based, strictly increasing per document
 * @param versionType   kind of save (see {@link VersionTypes})
 * @param content       full document text at this version
 * @param createdAt     when the version was appended
 */
public record Version(
        String id,
        String documentId,
        int versionNumber,
        String versionType,
        String content,
        Instant createdAt
) {

    public Version {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(versionType, "versionType must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (versionNumber < 1) {
            throw new IllegalArgumentException("versionNumber must be >= 1, got: " + versionNumber);
        }
    }

    /**
     * Returns true if this version was produced by a restore.
     */
    public boolean isRestore() {
        return VersionTypes.RESTORED.equals(versionType);
    }
}
