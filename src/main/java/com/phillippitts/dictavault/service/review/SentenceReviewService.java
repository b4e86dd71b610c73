package com.phillippitts.dictavault.service.review;

import com.phillippitts.dictavault.domain.ContentUnit;
import com.phillippitts.dictavault.domain.PrivacyLevel;
import com.phillippitts.dictavault.exception.DictaVaultException;
import com.phillippitts.dictavault.repository.ContentUnitRepository;
import com.phillippitts.dictavault.service.detect.PrivacyScanner;
import com.phillippitts.dictavault.service.metrics.PrivacyMetrics;
import com.phillippitts.dictavault.service.privacy.PrivacyStateStore;
import com.phillippitts.dictavault.service.review.event.ReviewCommittedEvent;
import com.phillippitts.dictavault.util.LogContext;
import com.phillippitts.dictavault.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Opens and commits sentence reviews.
 *
 * <p>Commit is best effort: each decided sentence is stored on its own, a failure is counted
 * and the remaining sentences are still attempted. Pending sentences are never stored.
 * For a private sentence the {@code private} level is recorded under the new unit's id before
 * the unit itself is inserted, so a stored unit is never left without its flag. If the insert
 * then fails the level is reset to the default.
 */
@Service
public class SentenceReviewService {

    private static final Logger LOG = LogManager.getLogger(SentenceReviewService.class);

    private final PrivacyScanner scanner;
    private final PrivacyStateStore privacyStore;
    private final ContentUnitRepository units;
    private final ApplicationEventPublisher publisher;
    private final PrivacyMetrics metrics;

    public SentenceReviewService(PrivacyScanner scanner,
                                 PrivacyStateStore privacyStore,
                                 ContentUnitRepository units,
                                 ApplicationEventPublisher publisher,
                                 PrivacyMetrics metrics) {
        this.scanner = Objects.requireNonNull(scanner);
        this.privacyStore = Objects.requireNonNull(privacyStore);
        this.units = Objects.requireNonNull(units);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Segments the transcript and scans each sentence.
     *
     * @return a review with every sentence pending and the cursor on the first one
     */
    public SentenceReviewSession open(String sessionId, String transcript) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        Objects.requireNonNull(transcript, "transcript must not be null");
        return LogContext.with(LogContext.SESSION_ID, sessionId, () -> {
            List<Sentence> sentences = SentenceSegmenter.segment(transcript);
            List<SentenceUnit> reviewUnits = new ArrayList<>(sentences.size());
            for (int i = 0; i < sentences.size(); i++) {
                String text = sentences.get(i).text();
                reviewUnits.add(new SentenceUnit(i, text, scanner.fullScan(text), ReviewDecision.PENDING));
            }
            LOG.info("Opened review with {} sentences for {}", reviewUnits.size(),
                    LogSanitizer.describe(transcript));
            return new SentenceReviewSession(sessionId, reviewUnits);
        });
    }

    /**
     * Materializes the review's decisions into content units and closes the review.
     *
     * @throws IllegalStateException if the review was already committed
     */
    public ReviewCommitResult commit(SentenceReviewSession review) {
        Objects.requireNonNull(review, "review must not be null");
        review.markCommitted();
        return LogContext.with(LogContext.SESSION_ID, review.getSessionId(), () -> {
            int publicCreated = 0;
            int privateCreated = 0;
            int skipped = 0;
            int failed = 0;
            for (SentenceUnit unit : review.getUnits()) {
                switch (unit.decision()) {
                    case PENDING -> skipped++;
                    case PUBLIC -> {
                        if (store(review.getSessionId(), unit, false)) {
                            publicCreated++;
                        } else {
                            failed++;
                        }
                    }
                    case PRIVATE -> {
                        if (store(review.getSessionId(), unit, true)) {
                            privateCreated++;
                        } else {
                            failed++;
                        }
                    }
                    default -> throw new IllegalStateException("Unknown decision " + unit.decision());
                }
            }
            ReviewCommitResult result = new ReviewCommitResult(publicCreated, privateCreated, skipped, failed);
            if (result.isPartial()) {
                LOG.warn("Review committed partially: {} stored, {} failed, {} pending skipped",
                        result.created(), failed, skipped);
            } else {
                LOG.info("Review committed: {} public, {} private, {} pending skipped",
                        publicCreated, privateCreated, skipped);
            }
            metrics.recordReviewCommit(result.isPartial() ? "partial" : "complete");
            publisher.publishEvent(new ReviewCommittedEvent(review.getSessionId(), result));
            return result;
        });
    }

    private boolean store(String sessionId, SentenceUnit unit, boolean isPrivate) {
        String unitId = UUID.randomUUID().toString();
        boolean levelWritten = false;
        try {
            if (isPrivate) {
                privacyStore.setLevel(unitId, PrivacyLevel.PRIVATE);
                levelWritten = true;
            }
            units.insert(new ContentUnit(
                    unitId,
                    sessionId,
                    unit.text(),
                    ContentUnit.BRAIN_DUMP,
                    isPrivate ? ContentUnit.PILE_VAULT : ContentUnit.PILE_INBOX,
                    Instant.now()));
            return true;
        } catch (DictaVaultException | DataAccessException e) {
            LOG.error("Failed to store sentence {} of review", unit.index(), e);
            if (levelWritten) {
                resetOrphanLevel(unitId, unit.index());
            }
            return false;
        }
    }

    private void resetOrphanLevel(String unitId, int index) {
        try {
            privacyStore.setLevel(unitId, PrivacyLevel.DEFAULT);
        } catch (DictaVaultException e) {
            LOG.warn("Could not reset privacy level left by unstored sentence {}", index, e);
        }
    }
}
