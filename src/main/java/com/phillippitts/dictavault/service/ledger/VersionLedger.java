package com.phillippitts.dictavault.service.ledger;

import com.phillippitts.dictavault.domain.Version;
import com.phillippitts.dictavault.exception.StorageException;
import com.phillippitts.dictavault.exception.VersionNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-document history of full-content saves.
 *
 * <p>For every document the version numbers run 1, 2, 3, ... without gaps or duplicates.
 * Existing versions are never changed; a restore appends a copy of the old content as a new
 * version. Every save also refreshes the document's current-content projection.
 *
 * <p>Thread Safety: concurrent saves to the same document are serialized; saves to different
 * documents do not block each other.
 *
 * <p>Storage failures are surfaced as {@link StorageException}.
 */
public interface VersionLedger {

    /**
     * Appends a version.
     *
     * @param documentId  document id
     * @param content     full document text
     * @param versionType kind of save, see {@link com.phillippitts.dictavault.domain.VersionTypes}
     * @return the allocated version number ({@code max(existing) + 1}, 1 for a new document)
     * @throws StorageException if the version could not be persisted
     */
    int saveVersion(String documentId, String content, String versionType);

    /**
     * @return all versions, highest version number first; empty if none
     */
    List<Version> getVersions(String documentId);

    Optional<Version> getLatestVersion(String documentId);

    Optional<Version> getVersion(String documentId, int versionNumber);

    /**
     * @return the number the next save would receive (1 for a document without versions)
     */
    int getNextVersionNumber(String documentId);

    /**
     * Appends a {@code restored} version carrying the content of {@code versionNumber}.
     *
     * @return the newly appended version
     * @throws VersionNotFoundException if the document has no such version
     * @throws StorageException if the new version could not be persisted
     */
    Version restore(String documentId, int versionNumber);

    /**
     * @return current content from the projection, if the document was ever saved
     */
    Optional<String> getCurrentContent(String documentId);
}
