package com.phillippitts.dictavault.repository;

import java.util.Optional;

/**
 * Storage port for the denormalized "current content" of each document.
 */
public interface DocumentContentRepository {

    /**
     * Inserts or replaces the current content of a document.
     */
    void upsert(String documentId, String content, int versionNumber);

    Optional<String> findContent(String documentId);
}
