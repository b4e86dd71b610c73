package com.phillippitts.dictavault.service.review;

import com.phillippitts.dictavault.domain.Match;

import java.util.List;
import java.util.Objects;

/**
 * A sentence under review together with its detected matches and current decision.
 * Match offsets are relative to {@link #text()}.
 */
public record SentenceUnit(int index, String text, List<Match> matches, ReviewDecision decision) {

    public SentenceUnit {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public SentenceUnit withDecision(ReviewDecision newDecision) {
        return new SentenceUnit(index, text, matches, newDecision);
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
