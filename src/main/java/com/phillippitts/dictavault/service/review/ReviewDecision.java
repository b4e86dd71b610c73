package com.phillippitts.dictavault.service.review;

/**
 * Decision for one sentence in a review. Every sentence starts {@link #PENDING}; once decided it
 * can only flip between {@link #PUBLIC} and {@link #PRIVATE}.
 */
public enum ReviewDecision {
    PENDING,
    PUBLIC,
    PRIVATE;

    public boolean isReviewed() {
        return this != PENDING;
    }

    /**
     * Single-sentence toggle: pending or public becomes private, private becomes public.
     */
    public ReviewDecision toggled() {
        return this == PRIVATE ? PUBLIC : PRIVATE;
    }
}
