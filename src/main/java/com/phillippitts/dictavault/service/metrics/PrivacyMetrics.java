package com.phillippitts.dictavault.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for detection, the version ledger, the vault and sentence review.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Scan latency per strategy (pattern, topic, full, classifier)</li>
 *   <li>Detected matches per category</li>
 *   <li>Classifier failures per reason</li>
 *   <li>Versions saved per version type</li>
 *   <li>Failed vault unlocks</li>
 *   <li>Review commits per outcome</li>
 * </ul>
 *
 * <p>Tags only carry categories, reasons and types, never user text.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PrivacyMetrics {

    private static final String METRIC_PREFIX = "dictavault";

    private final MeterRegistry registry;

    public PrivacyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one scan strategy took.
     *
     * @param strategy pattern, topic, full or classifier
     * @param durationNanos duration in nanoseconds
     */
    public void recordScanLatency(String strategy, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".scan.latency")
                .description("Time taken to scan text for sensitive content")
                .tag("strategy", strategy)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts detected matches of one category.
     */
    public void incrementMatches(String category, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".scan.matches")
                .description("Number of sensitive spans detected")
                .tag("category", category)
                .register(registry)
                .increment(count);
    }

    /**
     * Increments the classifier failure counter.
     *
     * @param reason failure reason (timeout, unreachable, model-missing, ...)
     */
    public void incrementClassifierFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".classifier.failure")
                .description("Number of failed classifier calls")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementClassifierSuccess() {
        Counter.builder(METRIC_PREFIX + ".classifier.success")
                .description("Number of successful classifier calls")
                .register(registry)
                .increment();
    }

    public void incrementVersionSaved(String versionType) {
        Counter.builder(METRIC_PREFIX + ".ledger.versions")
                .description("Number of versions appended to the ledger")
                .tag("type", versionType)
                .register(registry)
                .increment();
    }

    public void incrementUnlockFailure() {
        Counter.builder(METRIC_PREFIX + ".vault.unlock.failure")
                .description("Number of rejected vault unlock attempts")
                .register(registry)
                .increment();
    }

    /**
     * Records a review commit.
     *
     * @param outcome complete or partial
     */
    public void recordReviewCommit(String outcome) {
        Counter.builder(METRIC_PREFIX + ".review.commits")
                .description("Number of committed sentence reviews")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
