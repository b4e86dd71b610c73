package com.phillippitts.dictavault.service.events;

import com.phillippitts.dictavault.service.detect.event.ClassifierFailureEvent;
import com.phillippitts.dictavault.service.review.event.ReviewCommittedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-relevant degradation events. Privacy-safe and throttled to
 * avoid log spam.
 */
@Component
class PrivacyEventsListener {
    private static final Logger LOG = LogManager.getLogger(PrivacyEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);
    static final String PARTIAL_COMMIT_KEY = "partial-commit";

    @EventListener
    void onClassifierFailure(ClassifierFailureEvent e) {
        String key = "classifier-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Language-model classifier unavailable: reason={}. Detection continues with "
                    + "rule-based matches only. Check privacy.classifier.* settings.", e.reason());
        }
    }

    @EventListener
    void onReviewCommitted(ReviewCommittedEvent e) {
        if (!e.result().isPartial()) {
            return;
        }
        // one slot for all sessions; the service logs every partial commit at WARN
        if (shouldLog(PARTIAL_COMMIT_KEY)) {
            LOG.error("Review of session {} saved only partially: {} of {} decided sentences failed",
                    e.sessionId(), e.result().failed(), e.result().failed() + e.result().created());
        }
    }

    // Package-private for tests
    int trackedKeyCount() {
        return lastLog.size();
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
