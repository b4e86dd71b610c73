package com.phillippitts.dictavault.service.detect.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a classifier call yields no result because it failed or timed out.
 * Detection carried on with rule-based matches only.
 *
 * @param reason short failure reason (timeout, unreachable, model-missing, ...)
 * @param at     when the failure was observed
 */
public record ClassifierFailureEvent(String reason, Instant at) {
    public ClassifierFailureEvent {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
