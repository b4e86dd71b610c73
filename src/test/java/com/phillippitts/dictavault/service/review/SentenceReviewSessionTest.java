package com.phillippitts.dictavault.service.review;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceReviewSessionTest {

    private static SentenceReviewSession review(int sentences) {
        List<SentenceUnit> units = new ArrayList<>();
        for (int i = 0; i < sentences; i++) {
            units.add(new SentenceUnit(i, "Sentence " + i + ".", List.of(), ReviewDecision.PENDING));
        }
        return new SentenceReviewSession("s1", units);
    }

    @Test
    void startsPendingOnFirstSentence() {
        SentenceReviewSession review = review(3);

        assertThat(review.getCursor()).isZero();
        assertThat(review.current().index()).isZero();
        assertThat(review.pendingCount()).isEqualTo(3);
        assertThat(review.progress()).isZero();
        assertThat(review.isComplete()).isFalse();
    }

    @Test
    void swipesDecideAndAdvance() {
        SentenceReviewSession review = review(3);

        assertThat(review.classifyRight()).isTrue();
        assertThat(review.classifyLeft()).isTrue();

        assertThat(review.getUnits()).extracting(SentenceUnit::decision)
                .containsExactly(ReviewDecision.PUBLIC, ReviewDecision.PRIVATE, ReviewDecision.PENDING);
        assertThat(review.getCursor()).isEqualTo(2);
        assertThat(review.progress()).isEqualTo(2.0 / 3.0);
    }

    @Test
    void lastSwipeCompletesReviewAndFurtherSwipesAreNoOps() {
        SentenceReviewSession review = review(2);
        review.classifyRight();
        review.classifyRight();

        assertThat(review.isComplete()).isTrue();
        assertThat(review.current()).isNull();
        assertThat(review.classifyLeft()).isFalse();
        assertThat(review.toggle()).isFalse();
        assertThat(review.publicCount()).isEqualTo(2);
    }

    @Test
    void toggleFlipsWithoutMovingCursor() {
        SentenceReviewSession review = review(3);
        review.classifyRight();
        review.previous();

        review.toggle();
        assertThat(review.getUnits().get(0).decision()).isEqualTo(ReviewDecision.PRIVATE);
        review.toggle(0);
        assertThat(review.getUnits().get(0).decision()).isEqualTo(ReviewDecision.PUBLIC);
        assertThat(review.getCursor()).isZero();

        // pending becomes private, never back to pending
        review.toggle(2);
        assertThat(review.getUnits().get(2).decision()).isEqualTo(ReviewDecision.PRIVATE);
    }

    @Test
    void toggleRejectsIndexOutOfRange() {
        SentenceReviewSession review = review(2);

        assertThatThrownBy(() -> review.toggle(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> review.toggle(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void navigationStaysWithinBounds() {
        SentenceReviewSession review = review(3);

        review.previous();
        assertThat(review.getCursor()).isZero();
        review.next();
        review.next();
        review.next();
        assertThat(review.getCursor()).isEqualTo(2);
        assertThat(review.pendingCount()).isEqualTo(3);
    }

    @Test
    void previousFromCompletedReviewReturnsToLastSentence() {
        SentenceReviewSession review = review(2);
        review.markAllPublic();
        assertThat(review.getCursor()).isEqualTo(2);

        review.previous();

        assertThat(review.getCursor()).isEqualTo(1);
        assertThat(review.isComplete()).isFalse();
    }

    @Test
    void bulkActionsDecideEverything() {
        SentenceReviewSession review = review(4);
        review.classifyRight();

        review.markAllPrivate();

        assertThat(review.privateCount()).isEqualTo(4);
        assertThat(review.isComplete()).isTrue();
        assertThat(review.progress()).isEqualTo(1.0);
    }

    @Test
    void emptyReviewIsCompleteImmediately() {
        SentenceReviewSession review = review(0);

        assertThat(review.isComplete()).isTrue();
        assertThat(review.current()).isNull();
        assertThat(review.progress()).isZero();
        review.next();
        review.previous();
        assertThat(review.getCursor()).isZero();
    }

    @Test
    void committedReviewRejectsChanges() {
        SentenceReviewSession review = review(2);
        review.markCommitted();

        assertThat(review.isCommitted()).isTrue();
        assertThatThrownBy(review::classifyRight).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(review::markAllPublic).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(review::markCommitted).isInstanceOf(IllegalStateException.class);
    }
}
