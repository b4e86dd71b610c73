package com.phillippitts.dictavault.service.privacy;

import com.phillippitts.dictavault.domain.PrivacyTag;
import com.phillippitts.dictavault.domain.TagStatus;
import com.phillippitts.dictavault.exception.StorageExceptionBuilder;
import com.phillippitts.dictavault.repository.PrivacyTagRepository;
import com.phillippitts.dictavault.service.detect.PrivacyScanner;
import com.phillippitts.dictavault.util.KeyedLocks;
import com.phillippitts.dictavault.util.LogContext;
import com.phillippitts.dictavault.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Persists detector matches as reviewable privacy tags.
 *
 * <p>Scanning is idempotent per session: the first {@link #scanSession} stores one tag per
 * match; later calls return the stored tags and never recreate them, so review decisions
 * survive re-opening a session. Tags change only through {@link #updateStatus} and disappear
 * only with {@link #deleteSessionTags}.
 */
@Service
public class PrivacyTagService {

    private static final Logger LOG = LogManager.getLogger(PrivacyTagService.class);

    private final PrivacyTagRepository tags;
    private final PrivacyScanner scanner;
    private final KeyedLocks sessionLocks = new KeyedLocks();

    public PrivacyTagService(PrivacyTagRepository tags, PrivacyScanner scanner) {
        this.tags = Objects.requireNonNull(tags);
        this.scanner = Objects.requireNonNull(scanner);
    }

    /**
     * Tags the session's transcript on first call.
     *
     * @param sessionId session id
     * @param text      full session transcript
     * @return the session's tags ordered by start offset
     */
    public List<PrivacyTag> scanSession(String sessionId, String text) {
        requireSessionId(sessionId);
        Objects.requireNonNull(text, "text must not be null");
        return LogContext.with(LogContext.SESSION_ID, sessionId,
                () -> sessionLocks.withLock(sessionId, () -> scanOnce(sessionId, text)));
    }

    private List<PrivacyTag> scanOnce(String sessionId, String text) {
        if (storage("existsForSession", sessionId, () -> tags.existsForSession(sessionId))) {
            LOG.debug("Session already scanned; keeping existing tags");
            return getTags(sessionId);
        }
        List<PrivacyTag> created = scanner.fullScan(text).stream()
                .map(m -> PrivacyTag.fromMatch(sessionId, m))
                .toList();
        storage("insertTags", sessionId, () -> {
            tags.insertAll(created);
            return null;
        });
        LOG.info("Created {} privacy tags for {}", created.size(), LogSanitizer.describe(text));
        return getTags(sessionId);
    }

    public List<PrivacyTag> getTags(String sessionId) {
        requireSessionId(sessionId);
        return storage("findTags", sessionId, () -> tags.findBySession(sessionId));
    }

    /**
     * Records a review decision for one tag.
     *
     * @return false if no tag with this id exists
     */
    public boolean updateStatus(String tagId, TagStatus status) {
        Objects.requireNonNull(tagId, "tagId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        return storage("updateTagStatus", tagId, () -> tags.updateStatus(tagId, status));
    }

    public int countUnreviewed(String sessionId) {
        requireSessionId(sessionId);
        return storage("countUnreviewed", sessionId,
                () -> tags.countBySessionAndStatus(sessionId, TagStatus.UNREVIEWED));
    }

    /**
     * Removes all tags of a deleted session.
     *
     * @return number of removed tags
     */
    public int deleteSessionTags(String sessionId) {
        requireSessionId(sessionId);
        int removed = storage("deleteTags", sessionId, () -> tags.deleteBySession(sessionId));
        LOG.info("Deleted {} privacy tags of session {}", removed, sessionId);
        return removed;
    }

    private static <T> T storage(String operation, String id, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            LOG.error("Privacy tag operation {} failed", operation, e);
            throw StorageExceptionBuilder.create("Privacy tag operation failed")
                    .operation(operation)
                    .cause(e)
                    .metadata("id", id)
                    .build();
        }
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }
}
