package com.phillippitts.dictavault.service.review.event;

import com.phillippitts.dictavault.service.review.ReviewCommitResult;

import java.util.Objects;

/**
 * Published after a sentence review was committed, including partial commits.
 */
public record ReviewCommittedEvent(String sessionId, ReviewCommitResult result) {
    public ReviewCommittedEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }
}
