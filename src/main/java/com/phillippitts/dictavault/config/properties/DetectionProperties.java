package com.phillippitts.dictavault.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties for rule-based detection.
 *
 * <p>Example application.properties:
 * <pre>
 * privacy.detection.dedup-policy=FIRST_BY_START_OFFSET
 * privacy.detection.whole-word-topics=false
 * privacy.detection.extra-patterns.IBAN=[A-Z]{2}\\d{2}[A-Z0-9]{11,30}
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "privacy.detection")
public class DetectionProperties {

    /**
     * How {@code fullScan} collapses matches that share a position.
     */
    public enum DedupPolicy {
        /** At most one match per start offset, first in sorted order wins. */
        FIRST_BY_START_OFFSET,
        /** At most one match per (start, end) span; different spans at the same start survive. */
        BY_SPAN
    }

    @NotNull
    private final DedupPolicy dedupPolicy;

    /**
     * If true, topic keywords only match on word boundaries ("scan" no longer fires inside
     * "scandal"). Off by default to keep plain substring behavior.
     */
    private final boolean wholeWordTopics;

    /** Additional category-name to regex entries appended after the built-in pattern table. */
    private final Map<String, String> extraPatterns;

    @ConstructorBinding
    public DetectionProperties(DedupPolicy dedupPolicy,
                               Boolean wholeWordTopics,
                               Map<String, String> extraPatterns) {
        this.dedupPolicy = dedupPolicy == null ? DedupPolicy.FIRST_BY_START_OFFSET : dedupPolicy;
        this.wholeWordTopics = wholeWordTopics != null && wholeWordTopics;
        this.extraPatterns = extraPatterns == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraPatterns));
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public DetectionProperties() {
        this(null, null, null);
    }

    public DedupPolicy getDedupPolicy() {
        return dedupPolicy;
    }

    public boolean isWholeWordTopics() {
        return wholeWordTopics;
    }

    public Map<String, String> getExtraPatterns() {
        return extraPatterns;
    }
}
