package com.phillippitts.dictavault.service.review;

/**
 * Outcome of committing a sentence review.
 *
 * @param publicCreated  public units stored
 * @param privateCreated private units stored with their private level recorded
 * @param skippedPending sentences left pending, never materialized
 * @param failed         decided sentences that could not be stored
 */
public record ReviewCommitResult(int publicCreated, int privateCreated, int skippedPending, int failed) {

    public int created() {
        return publicCreated + privateCreated;
    }

    /**
     * @return true if at least one decided sentence was not stored
     */
    public boolean isPartial() {
        return failed > 0;
    }
}
