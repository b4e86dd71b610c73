package com.phillippitts.dictavault.repository;

import com.phillippitts.dictavault.domain.Version;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for the append-only version log.
 *
 * <p>Implementations must reject a second row with the same {@code (documentId, versionNumber)}
 * by throwing {@link org.springframework.dao.DuplicateKeyException}. There is deliberately no
 * update or delete operation.
 */
public interface VersionRepository {

    /**
     * @return highest stored version number for the document, or 0 if it has none
     */
    int findMaxVersionNumber(String documentId);

    void insert(Version version);

    /**
     * @return all versions of the document, highest version number first
     */
    List<Version> findAllByDocumentIdDesc(String documentId);

    Optional<Version> findLatest(String documentId);

    Optional<Version> find(String documentId, int versionNumber);
}
