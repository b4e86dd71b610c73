package com.phillippitts.dictavault.service.events;

import com.phillippitts.dictavault.service.detect.event.ClassifierFailureEvent;
import com.phillippitts.dictavault.service.review.ReviewCommitResult;
import com.phillippitts.dictavault.service.review.event.ReviewCommittedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PrivacyEventsListenerTest {

    @Test
    void throttlesRepeatedKeys() {
        PrivacyEventsListener listener = new PrivacyEventsListener();

        assertThat(listener.shouldLog("classifier-timeout")).isTrue();
        assertThat(listener.shouldLog("classifier-timeout")).isFalse();
        assertThat(listener.shouldLog("classifier-unreachable")).isTrue();
    }

    @Test
    void handlesEventsWithoutThrowing() {
        PrivacyEventsListener listener = new PrivacyEventsListener();

        assertThatCode(() -> {
            listener.onClassifierFailure(new ClassifierFailureEvent("timeout", Instant.now()));
            listener.onClassifierFailure(new ClassifierFailureEvent("timeout", Instant.now()));
            listener.onReviewCommitted(new ReviewCommittedEvent("s1", new ReviewCommitResult(2, 0, 0, 0)));
            listener.onReviewCommitted(new ReviewCommittedEvent("s1", new ReviewCommitResult(1, 0, 0, 1)));
        }).doesNotThrowAnyException();

        // the partial commit consumed its throttle slot, the complete one did not
        assertThat(listener.shouldLog(PrivacyEventsListener.PARTIAL_COMMIT_KEY)).isFalse();
    }

    @Test
    void partialCommitsShareOneThrottleSlotAcrossSessions() {
        PrivacyEventsListener listener = new PrivacyEventsListener();

        for (int i = 0; i < 100; i++) {
            listener.onReviewCommitted(new ReviewCommittedEvent("session-" + i, new ReviewCommitResult(1, 0, 0, 1)));
        }

        assertThat(listener.trackedKeyCount()).isEqualTo(1);
    }
}
