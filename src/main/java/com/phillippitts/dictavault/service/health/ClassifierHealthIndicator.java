package com.phillippitts.dictavault.service.health;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.service.detect.llm.LanguageModelClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the language-model classifier.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: classifier disabled, or enabled and reachable</li>
 *   <li>DEGRADED: enabled but unreachable; rule-based detection still works</li>
 * </ul>
 *
 * <p>Never DOWN: the classifier is an optional signal.
 */
@Component
public class ClassifierHealthIndicator implements HealthIndicator {

    private final LanguageModelClient client;
    private final ClassifierProperties props;

    public ClassifierHealthIndicator(LanguageModelClient client, ClassifierProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        if (!props.isEnabled()) {
            return builder.up()
                    .withDetail("status", "Classifier disabled")
                    .build();
        }
        if (client.isAvailable()) {
            builder.up().withDetail("status", "Classifier reachable");
        } else {
            builder.status("DEGRADED").withDetail("status", "Classifier unreachable, rule-based detection only");
        }
        return builder
                .withDetail("backend", client.getName())
                .withDetail("model", props.getModel())
                .build();
    }
}
