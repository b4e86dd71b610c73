package com.phillippitts.dictavault.domain;

import java.util.List;

/**
 * Outcome of the publish gate.
 *
 * @param ready    true iff {@code blockers} is empty
 * @param blockers human-readable reasons publishing is blocked, in evaluation order
 */
public record PublishReadiness(boolean ready, List<String> blockers) {

    public PublishReadiness {
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
        if (ready != blockers.isEmpty()) {
            throw new IllegalArgumentException("ready must be true exactly when there are no blockers");
        }
    }

    public static PublishReadiness of(List<String> blockers) {
        return new PublishReadiness(blockers == null || blockers.isEmpty(), blockers);
    }
}
