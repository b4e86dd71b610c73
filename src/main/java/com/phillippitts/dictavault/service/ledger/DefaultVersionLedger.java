package com.phillippitts.dictavault.service.ledger;

import com.phillippitts.dictavault.domain.Version;
import com.phillippitts.dictavault.domain.VersionTypes;
import com.phillippitts.dictavault.exception.StorageExceptionBuilder;
import com.phillippitts.dictavault.exception.VersionNotFoundException;
import com.phillippitts.dictavault.repository.DocumentContentRepository;
import com.phillippitts.dictavault.repository.VersionRepository;
import com.phillippitts.dictavault.service.metrics.PrivacyMetrics;
import com.phillippitts.dictavault.util.KeyedLocks;
import com.phillippitts.dictavault.util.LogContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link VersionLedger} on top of the version and content repositories.
 *
 * <p>Number allocation and insert run as one unit: an in-process lock per document id,
 * around a transaction that reads {@code max(version_number)}, inserts the new row and rewrites
 * the current-content projection. The storage uniqueness constraint on
 * {@code (document_id, version_number)} catches writers outside this process; such a collision
 * is retried with a freshly computed number.
 */
@Service
public class DefaultVersionLedger implements VersionLedger {

    private static final Logger LOG = LogManager.getLogger(DefaultVersionLedger.class);

    static final int MAX_ALLOCATION_ATTEMPTS = 3;

    private final VersionRepository versions;
    private final DocumentContentRepository contents;
    private final TransactionTemplate tx;
    private final PrivacyMetrics metrics;
    private final KeyedLocks documentLocks = new KeyedLocks();

    public DefaultVersionLedger(VersionRepository versions,
                                DocumentContentRepository contents,
                                TransactionTemplate tx,
                                PrivacyMetrics metrics) {
        this.versions = Objects.requireNonNull(versions);
        this.contents = Objects.requireNonNull(contents);
        this.tx = Objects.requireNonNull(tx);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public int saveVersion(String documentId, String content, String versionType) {
        requireDocumentId(documentId);
        Objects.requireNonNull(content, "content must not be null");
        if (versionType == null || versionType.isBlank()) {
            throw new IllegalArgumentException("versionType must not be blank");
        }
        return LogContext.with(LogContext.DOCUMENT_ID, documentId,
                () -> documentLocks.withLock(documentId, () -> append(documentId, content, versionType)));
    }

    private int append(String documentId, String content, String versionType) {
        for (int attempt = 1; ; attempt++) {
            try {
                Integer saved = tx.execute(status -> {
                    int next = versions.findMaxVersionNumber(documentId) + 1;
                    versions.insert(new Version(UUID.randomUUID().toString(), documentId, next,
                            versionType, content, Instant.now()));
                    contents.upsert(documentId, content, next);
                    return next;
                });
                int number = Objects.requireNonNull(saved);
                metrics.incrementVersionSaved(versionType);
                LOG.info("Saved version {} ({}) of document, {} chars", number, versionType, content.length());
                return number;
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_ALLOCATION_ATTEMPTS) {
                    throw storageFailure("saveVersion", documentId, e);
                }
                LOG.warn("Version number collision on attempt {}, retrying", attempt);
            } catch (DataAccessException | TransactionException e) {
                throw storageFailure("saveVersion", documentId, e);
            }
        }
    }

    @Override
    public List<Version> getVersions(String documentId) {
        requireDocumentId(documentId);
        try {
            return versions.findAllByDocumentIdDesc(documentId);
        } catch (DataAccessException e) {
            throw storageFailure("getVersions", documentId, e);
        }
    }

    @Override
    public Optional<Version> getLatestVersion(String documentId) {
        requireDocumentId(documentId);
        try {
            return versions.findLatest(documentId);
        } catch (DataAccessException e) {
            throw storageFailure("getLatestVersion", documentId, e);
        }
    }

    @Override
    public Optional<Version> getVersion(String documentId, int versionNumber) {
        requireDocumentId(documentId);
        try {
            return versions.find(documentId, versionNumber);
        } catch (DataAccessException e) {
            throw storageFailure("getVersion", documentId, e);
        }
    }

    @Override
    public int getNextVersionNumber(String documentId) {
        requireDocumentId(documentId);
        try {
            return versions.findMaxVersionNumber(documentId) + 1;
        } catch (DataAccessException e) {
            throw storageFailure("getNextVersionNumber", documentId, e);
        }
    }

    @Override
    public Version restore(String documentId, int versionNumber) {
        requireDocumentId(documentId);
        return LogContext.with(LogContext.DOCUMENT_ID, documentId, () -> {
            Version source = getVersion(documentId, versionNumber).orElseThrow(() -> {
                LOG.warn("Restore requested for missing version {}", versionNumber);
                return new VersionNotFoundException(documentId, versionNumber);
            });
            int restored = saveVersion(documentId, source.content(), VersionTypes.RESTORED);
            LOG.info("Restored version {} as version {}", versionNumber, restored);
            return getVersion(documentId, restored).orElseThrow(() -> StorageExceptionBuilder
                    .create("Restored version vanished after save")
                    .operation("restore")
                    .metadata("documentId", documentId)
                    .metadata("versionNumber", restored)
                    .build());
        });
    }

    @Override
    public Optional<String> getCurrentContent(String documentId) {
        requireDocumentId(documentId);
        try {
            return contents.findContent(documentId);
        } catch (DataAccessException e) {
            throw storageFailure("getCurrentContent", documentId, e);
        }
    }

    private RuntimeException storageFailure(String operation, String documentId, RuntimeException e) {
        LOG.error("Ledger operation {} failed", operation, e);
        return StorageExceptionBuilder.create("Version ledger operation failed")
                .operation(operation)
                .cause(e)
                .metadata("documentId", documentId)
                .build();
    }

    private static void requireDocumentId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
    }
}
