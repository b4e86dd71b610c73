package com.phillippitts.dictavault.service.review;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Interactive, sentence-by-sentence privacy review of one transcript.
 *
 * <p>State machine per sentence: {@code PENDING -> PUBLIC | PRIVATE}, after which a toggle flips
 * between the two; there is no way back to {@code PENDING}. A cursor points at the current
 * sentence:
 * <ul>
 *   <li>{@link #classifyRight()} / {@link #classifyLeft()} decide the current sentence and
 *       advance the cursor, possibly past the last sentence</li>
 *   <li>{@link #next()} / {@link #previous()} move the cursor within {@code [0, count-1]}
 *       without touching decisions</li>
 *   <li>{@link #markAllPublic()} / {@link #markAllPrivate()} decide everything and move the
 *       cursor past the end</li>
 * </ul>
 * The review is complete once the cursor is past the last sentence.
 *
 * <p>Not thread-safe: a review belongs to a single interactive user. After
 * {@link SentenceReviewService#commit} every mutating call throws {@link IllegalStateException}.
 */
public class SentenceReviewSession {

    private final String sessionId;
    private final List<SentenceUnit> units;
    private int cursor;
    private boolean committed;

    SentenceReviewSession(String sessionId, List<SentenceUnit> units) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.units = new ArrayList<>(Objects.requireNonNull(units, "units must not be null"));
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<SentenceUnit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public int size() {
        return units.size();
    }

    public int getCursor() {
        return cursor;
    }

    /**
     * @return the sentence under the cursor, or null when the review is complete
     */
    public SentenceUnit current() {
        return cursor < units.size() ? units.get(cursor) : null;
    }

    /**
     * Marks the current sentence public and advances. No-op when complete.
     *
     * @return true if a sentence was decided
     */
    public boolean classifyRight() {
        return decideAndAdvance(ReviewDecision.PUBLIC);
    }

    /**
     * Marks the current sentence private and advances. No-op when complete.
     *
     * @return true if a sentence was decided
     */
    public boolean classifyLeft() {
        return decideAndAdvance(ReviewDecision.PRIVATE);
    }

    /**
     * Toggles the sentence under the cursor. No-op when complete.
     */
    public boolean toggle() {
        ensureOpen();
        if (cursor >= units.size()) {
            return false;
        }
        return toggle(cursor);
    }

    /**
     * Toggles the sentence at {@code index} without moving the cursor.
     *
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size)}
     */
    public boolean toggle(int index) {
        ensureOpen();
        Objects.checkIndex(index, units.size());
        SentenceUnit unit = units.get(index);
        units.set(index, unit.withDecision(unit.decision().toggled()));
        return true;
    }

    public void markAllPublic() {
        markAll(ReviewDecision.PUBLIC);
    }

    public void markAllPrivate() {
        markAll(ReviewDecision.PRIVATE);
    }

    public void next() {
        ensureOpen();
        if (units.isEmpty()) {
            return;
        }
        cursor = Math.min(cursor + 1, units.size() - 1);
    }

    public void previous() {
        ensureOpen();
        if (units.isEmpty()) {
            return;
        }
        cursor = Math.max(0, Math.min(cursor - 1, units.size() - 1));
    }

    public boolean isComplete() {
        return cursor >= units.size();
    }

    public boolean isCommitted() {
        return committed;
    }

    public int reviewedCount() {
        return (int) units.stream().filter(u -> u.decision().isReviewed()).count();
    }

    public int publicCount() {
        return count(ReviewDecision.PUBLIC);
    }

    public int privateCount() {
        return count(ReviewDecision.PRIVATE);
    }

    public int pendingCount() {
        return count(ReviewDecision.PENDING);
    }

    /**
     * @return reviewed sentences divided by all sentences; 0 for an empty review
     */
    public double progress() {
        return units.isEmpty() ? 0.0 : (double) reviewedCount() / units.size();
    }

    void markCommitted() {
        ensureOpen();
        committed = true;
    }

    private boolean decideAndAdvance(ReviewDecision decision) {
        ensureOpen();
        if (cursor >= units.size()) {
            return false;
        }
        units.set(cursor, units.get(cursor).withDecision(decision));
        cursor++;
        return true;
    }

    private void markAll(ReviewDecision decision) {
        ensureOpen();
        units.replaceAll(u -> u.withDecision(decision));
        cursor = units.size();
    }

    private int count(ReviewDecision decision) {
        return (int) units.stream().filter(u -> u.decision() == decision).count();
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Review of session " + sessionId + " is already committed");
        }
    }
}
