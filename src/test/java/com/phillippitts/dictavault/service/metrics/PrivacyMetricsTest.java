package com.phillippitts.dictavault.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PrivacyMetricsTest {

    private SimpleMeterRegistry registry;
    private PrivacyMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PrivacyMetrics(registry);
    }

    @Test
    void recordsScanLatencyPerStrategy() {
        metrics.recordScanLatency("pattern", TimeUnit.MILLISECONDS.toNanos(5));
        metrics.recordScanLatency("pattern", TimeUnit.MILLISECONDS.toNanos(15));

        var timer = registry.get("dictavault.scan.latency").tag("strategy", "pattern").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);
    }

    @Test
    void ignoresNonPositiveMatchCounts() {
        metrics.incrementMatches("Email", 0);
        metrics.incrementMatches("Email", 3);

        assertThat(registry.get("dictavault.scan.matches").tag("category", "Email").counter().count())
                .isEqualTo(3.0);
        assertThat(registry.find("dictavault.scan.matches").tag("category", "SSN").counter()).isNull();
    }

    @Test
    void tagsClassifierFailuresByReason() {
        metrics.incrementClassifierFailure("timeout");
        metrics.incrementClassifierFailure("timeout");
        metrics.incrementClassifierFailure("unreachable");

        assertThat(registry.get("dictavault.classifier.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("dictavault.classifier.failure").tag("reason", "unreachable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void countsLedgerVaultAndReviewEvents() {
        metrics.incrementVersionSaved("raw");
        metrics.incrementUnlockFailure();
        metrics.recordReviewCommit("complete");
        metrics.incrementClassifierSuccess();

        assertThat(registry.get("dictavault.ledger.versions").tag("type", "raw").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("dictavault.vault.unlock.failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("dictavault.review.commits").tag("outcome", "complete").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("dictavault.classifier.success").counter().count()).isEqualTo(1.0);
    }
}
