package com.phillippitts.dictavault.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted, reviewable record of a detected span tied to a session.
 *
 * @param id          unique tag id
 * @param sessionId   owning session
 * @param startOffset inclusive start offset into the session transcript
 * @param endOffset   exclusive end offset into the session transcript
 * @param status      review status
 * @param tagType     detector category that produced the tag (see {@link Match#category()})
 * @param createdAt   creation time
 */
public record PrivacyTag(
        String id,
        String sessionId,
        int startOffset,
        int endOffset,
        TagStatus status,
        String tagType,
        Instant createdAt
) {

    public PrivacyTag {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(tagType, "tagType must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (startOffset < 0 || endOffset <= startOffset) {
            throw new IllegalArgumentException(
                    "Invalid tag span [" + startOffset + ", " + endOffset + ")");
        }
    }

    /**
     * Creates a fresh, unreviewed tag from a detector match.
     */
    public static PrivacyTag fromMatch(String sessionId, Match match) {
        return new PrivacyTag(
                UUID.randomUUID().toString(),
                sessionId,
                match.startOffset(),
                match.endOffset(),
                TagStatus.UNREVIEWED,
                match.category(),
                Instant.now()
        );
    }

    public boolean isReviewed() {
        return status != TagStatus.UNREVIEWED;
    }

    public PrivacyTag withStatus(TagStatus newStatus) {
        return new PrivacyTag(id, sessionId, startOffset, endOffset, newStatus, tagType, createdAt);
    }
}
