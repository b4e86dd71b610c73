package com.phillippitts.dictavault.service.detect.llm;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.domain.Match;
import com.phillippitts.dictavault.exception.ClassifierUnavailableException;
import com.phillippitts.dictavault.service.detect.event.ClassifierFailureEvent;
import com.phillippitts.dictavault.service.metrics.PrivacyMetrics;
import com.phillippitts.dictavault.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the language-model classifier as a bounded asynchronous task.
 *
 * <p>The returned future never completes exceptionally on classifier trouble: a timeout,
 * network error, malformed answer or a saturated pool completes it with an empty list, increments
 * {@code dictavault.classifier.failure} and publishes a {@link ClassifierFailureEvent}.
 * The answer is parsed in one step after it arrives, so a call that is cancelled or times out
 * contributes no matches at all.
 *
 * <p>When {@code privacy.classifier.enabled=false} or the text is blank, no request is made.
 */
@Service
public class LlmPrivacyClassifier {

    private static final Logger LOG = LogManager.getLogger(LlmPrivacyClassifier.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_REJECTED = "rejected";
    static final String REASON_ERROR = "error";

    private final LanguageModelClient client;
    private final Executor executor;
    private final ClassifierProperties props;
    private final PrivacyMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public LlmPrivacyClassifier(LanguageModelClient client,
                                @Qualifier("classifierExecutor") Executor executor,
                                ClassifierProperties props,
                                PrivacyMetrics metrics,
                                ApplicationEventPublisher publisher) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Starts a classification.
     *
     * @param text text to classify
     * @return future of matches, completed with an empty list on any classifier failure
     */
    public CompletableFuture<List<Match>> classifyAsync(String text) {
        if (!props.isEnabled() || text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        long t0 = System.nanoTime();
        CompletableFuture<List<Match>> call;
        try {
            call = CompletableFuture.supplyAsync(() -> ClassifierResponseParser.parse(
                    client.generate(ClassifierPrompt.build(text)), text), executor);
        } catch (RejectedExecutionException e) {
            metrics.recordScanLatency("classifier", System.nanoTime() - t0);
            onFailure(e);
            return CompletableFuture.completedFuture(List.of());
        }
        return call
                .orTimeout(props.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((matches, error) -> {
                    metrics.recordScanLatency("classifier", System.nanoTime() - t0);
                    if (error == null) {
                        metrics.incrementClassifierSuccess();
                        LOG.debug("Classifier {} returned {} matches for {}",
                                client.getName(), matches.size(), LogSanitizer.describe(text));
                        return matches;
                    }
                    onFailure(error);
                    return List.of();
                });
    }

    /**
     * Blocking variant of {@link #classifyAsync(String)}. Never throws on classifier trouble;
     * a cancelled or interrupted call yields an empty list.
     */
    public List<Match> classify(String text) {
        try {
            return classifyAsync(text).join();
        } catch (CancellationException | CompletionException e) {
            LOG.debug("Classification abandoned: {}", e.toString());
            return List.of();
        }
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    private void onFailure(Throwable error) {
        Throwable cause = unwrap(error);
        String reason;
        if (cause instanceof TimeoutException) {
            reason = REASON_TIMEOUT;
            LOG.warn("Classifier {} timed out after {} ms; using rule-based matches only",
                    client.getName(), props.getTimeoutMs());
        } else if (cause instanceof ClassifierUnavailableException cue) {
            reason = cue.getReason();
            LOG.warn("Classifier {} unavailable: {}", client.getName(), cue.getMessage());
        } else if (cause instanceof RejectedExecutionException) {
            reason = REASON_REJECTED;
            LOG.warn("Classifier {} request rejected: pool saturated; using rule-based matches only",
                    client.getName());
        } else {
            reason = REASON_ERROR;
            LOG.error("Classifier {} failed unexpectedly", client.getName(), cause);
        }
        metrics.incrementClassifierFailure(reason);
        publisher.publishEvent(new ClassifierFailureEvent(reason, Instant.now()));
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
