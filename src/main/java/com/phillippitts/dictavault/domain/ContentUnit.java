package com.phillippitts.dictavault.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A standalone piece of content (a card) materialized from a reviewed sentence.
 *
 * <p>The unit's privacy level is not stored here; it lives in the privacy level store
 * keyed by {@link #id()}, where absence means public.
 *
 * @param id        unique card id
 * @param sessionId session the sentence came from
 * @param content   sentence text
 * @param tagType   content kind, {@link #BRAIN_DUMP} for review output
 * @param pile      board pile the card lands in ({@link #PILE_INBOX} or {@link #PILE_VAULT})
 * @param createdAt creation time
 */
public record ContentUnit(
        String id,
        String sessionId,
        String content,
        String tagType,
        String pile,
        Instant createdAt
) {

    public static final String BRAIN_DUMP = "brain_dump";
    public static final String PILE_INBOX = "inbox";
    public static final String PILE_VAULT = "vault";

    public ContentUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(tagType, "tagType must not be null");
        Objects.requireNonNull(pile, "pile must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
