package com.phillippitts.dictavault.service.detect;

import com.phillippitts.dictavault.config.properties.DetectionProperties.DedupPolicy;
import com.phillippitts.dictavault.domain.Match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combines match lists from several detectors into one ordered, de-duplicated list.
 *
 * <p>Inputs are concatenated in argument order and stably sorted by start offset, so for equal
 * positions the earlier detector wins. {@link DedupPolicy#FIRST_BY_START_OFFSET} keeps one
 * match per start offset; a second category firing at the same position is dropped.
 * {@link DedupPolicy#BY_SPAN} only drops exact {@code (start, end)} duplicates.
 */
public final class MatchMerger {

    private final DedupPolicy policy;

    public MatchMerger(DedupPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @SafeVarargs
    public final List<Match> merge(List<Match>... sources) {
        List<Match> all = new ArrayList<>();
        for (List<Match> source : sources) {
            if (source != null) {
                all.addAll(source);
            }
        }
        // List.sort is stable
        all.sort(Comparator.comparingInt(Match::startOffset));

        List<Match> result = new ArrayList<>(all.size());
        Set<Long> seen = new HashSet<>();
        for (Match m : all) {
            if (seen.add(key(m))) {
                result.add(m);
            }
        }
        return result;
    }

    public DedupPolicy getPolicy() {
        return policy;
    }

    private long key(Match m) {
        if (policy == DedupPolicy.BY_SPAN) {
            return ((long) m.startOffset() << 32) | (m.endOffset() & 0xffffffffL);
        }
        return m.startOffset();
    }
}
