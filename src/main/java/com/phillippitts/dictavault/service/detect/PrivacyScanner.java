package com.phillippitts.dictavault.service.detect;

import com.phillippitts.dictavault.config.properties.DetectionProperties;
import com.phillippitts.dictavault.domain.Match;
import com.phillippitts.dictavault.service.detect.llm.LlmPrivacyClassifier;
import com.phillippitts.dictavault.service.metrics.PrivacyMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Entry point of the detector engine.
 *
 * <p>Combines three strategies:
 * <ul>
 *   <li><b>Pattern scan</b> ({@link #scan}): regular expressions for structured data</li>
 *   <li><b>Topic scan</b> ({@link #scanTopics}): keyword dictionaries, category {@code Topic:*}</li>
 *   <li><b>Classifier</b> ({@link #classifyExternally}): optional language model,
 *       category {@code LLM:*}</li>
 * </ul>
 *
 * <p>All methods are side-effect free on their input and safe to call concurrently. Every
 * returned match satisfies {@code 0 <= start < end <= text.length()}; an approximate classifier
 * match is clamped to the text.
 */
@Service
public class PrivacyScanner {

    private static final Logger LOG = LogManager.getLogger(PrivacyScanner.class);

    private final PatternDetector patternDetector;
    private final TopicDetector topicDetector;
    private final MatchMerger merger;
    private final LlmPrivacyClassifier classifier;
    private final PrivacyMetrics metrics;

    @Autowired
    public PrivacyScanner(DetectionProperties props,
                          LlmPrivacyClassifier classifier,
                          PrivacyMetrics metrics) {
        this(new PatternDetector(props.getExtraPatterns()),
                new TopicDetector(props.isWholeWordTopics()),
                new MatchMerger(props.getDedupPolicy()),
                classifier,
                metrics);
    }

    // Package-private for tests
    PrivacyScanner(PatternDetector patternDetector,
                   TopicDetector topicDetector,
                   MatchMerger merger,
                   LlmPrivacyClassifier classifier,
                   PrivacyMetrics metrics) {
        this.patternDetector = Objects.requireNonNull(patternDetector);
        this.topicDetector = Objects.requireNonNull(topicDetector);
        this.merger = Objects.requireNonNull(merger);
        this.classifier = Objects.requireNonNull(classifier);
        this.metrics = Objects.requireNonNull(metrics);
        LOG.info("Privacy scanner ready: {} patterns, dedup={}, skipped patterns={}",
                patternDetector.categories().size(), merger.getPolicy(),
                patternDetector.compileErrors().size());
    }

    /**
     * Pattern matches, sorted by start offset. Several patterns may report the same span.
     */
    public List<Match> scan(String text) {
        long t0 = System.nanoTime();
        List<Match> matches = patternDetector.scan(text);
        metrics.recordScanLatency("pattern", System.nanoTime() - t0);
        return matches;
    }

    /**
     * Topic keyword matches, sorted by start offset, at most one per start offset.
     */
    public List<Match> scanTopics(String text) {
        long t0 = System.nanoTime();
        List<Match> matches = topicDetector.scan(text);
        metrics.recordScanLatency("topic", System.nanoTime() - t0);
        return matches;
    }

    /**
     * Pattern and topic matches merged with the configured dedup policy. Under the default
     * policy the result is sorted by start offset with no two matches sharing a start offset;
     * pattern matches win over topic matches at the same position.
     */
    public List<Match> fullScan(String text) {
        long t0 = System.nanoTime();
        List<Match> merged = merger.merge(patternDetector.scan(text), topicDetector.scan(text));
        metrics.recordScanLatency("full", System.nanoTime() - t0);
        countByCategory(merged);
        return merged;
    }

    /**
     * Quick check whether any topic keyword occurs in the text.
     */
    public boolean containsPrivateTopics(String text) {
        return topicDetector.containsAny(text);
    }

    /**
     * Asks the language-model classifier. The future completes with an empty list when the
     * classifier is disabled, fails or times out.
     */
    public CompletableFuture<List<Match>> classifyExternally(String text) {
        return classifier.classifyAsync(text);
    }

    /**
     * Full scan plus classifier matches. The classifier request starts first and runs while
     * the rule-based scans execute; its matches are merged last, so a rule-based match wins
     * a shared position.
     */
    public List<Match> scanWithClassifier(String text) {
        CompletableFuture<List<Match>> external = classifier.classifyAsync(text);
        List<Match> rules = merger.merge(patternDetector.scan(text), topicDetector.scan(text));
        List<Match> llm = getResultSilently(external);
        List<Match> merged = merger.merge(rules, llm);
        countByCategory(merged);
        return merged;
    }

    private List<Match> getResultSilently(CompletableFuture<List<Match>> f) {
        try {
            return f.join();
        } catch (RuntimeException e) {
            // cancelled by another holder of the future
            LOG.debug("Classifier result unavailable: {}", e.toString());
            return List.of();
        }
    }

    private void countByCategory(List<Match> matches) {
        Map<String, Long> counts = matches.stream()
                .collect(Collectors.groupingBy(Match::category, Collectors.counting()));
        counts.forEach((category, n) -> metrics.incrementMatches(category, n.intValue()));
    }
}
