package com.phillippitts.dictavault.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the optional language-model privacy classifier.
 *
 * <p>The classifier is disabled by default; rule-based detection never depends on it.
 *
 * <p>Example application.properties:
 * <pre>
 * privacy.classifier.enabled=true
 * privacy.classifier.base-url=http://localhost:11434
 * privacy.classifier.model=dolphin3:latest
 * privacy.classifier.timeout-ms=20000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "privacy.classifier")
public class ClassifierProperties {

    private final boolean enabled;

    @NotBlank
    private final String baseUrl;

    @NotBlank
    private final String model;

    /** Upper bound for one classification, including queueing on the classifier pool. */
    @Positive
    private final long timeoutMs;

    @Positive
    private final int connectTimeoutMs;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    /** Maximum number of tokens the model may generate. */
    @Positive
    private final int maxTokens;

    @ConstructorBinding
    public ClassifierProperties(Boolean enabled,
                                String baseUrl,
                                String model,
                                Long timeoutMs,
                                Integer connectTimeoutMs,
                                Double temperature,
                                Integer maxTokens) {
        this.enabled = enabled != null && enabled;
        this.baseUrl = baseUrl == null ? "http://localhost:11434" : baseUrl;
        this.model = model == null ? "dolphin3:latest" : model;
        this.timeoutMs = timeoutMs == null ? 20_000L : timeoutMs;
        this.connectTimeoutMs = connectTimeoutMs == null ? 2_000 : connectTimeoutMs;
        this.temperature = temperature == null ? 0.3 : temperature;
        this.maxTokens = maxTokens == null ? 500 : maxTokens;
    }

    /**
     * Convenience constructor for tests: defaults everything except enablement and timeout.
     */
    public ClassifierProperties(boolean enabled, long timeoutMs) {
        this(enabled, null, null, timeoutMs, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
