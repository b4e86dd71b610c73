package com.phillippitts.dictavault.config.properties;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesDefaultsTest {

    @Test
    void detectionDefaults() {
        DetectionProperties props = new DetectionProperties();

        assertThat(props.getDedupPolicy()).isEqualTo(DetectionProperties.DedupPolicy.FIRST_BY_START_OFFSET);
        assertThat(props.isWholeWordTopics()).isFalse();
        assertThat(props.getExtraPatterns()).isEmpty();
    }

    @Test
    void detectionExtraPatternsKeepInsertionOrder() {
        DetectionProperties props = new DetectionProperties(null, true,
                new LinkedHashMap<>(Map.of("IBAN", "[A-Z]{2}\\d{2}")));

        assertThat(props.isWholeWordTopics()).isTrue();
        assertThat(props.getExtraPatterns()).containsEntry("IBAN", "[A-Z]{2}\\d{2}");
    }

    @Test
    void classifierIsDisabledByDefault() {
        ClassifierProperties props = new ClassifierProperties(null, null, null, null, null, null, null);

        assertThat(props.isEnabled()).isFalse();
        assertThat(props.getBaseUrl()).isEqualTo("http://localhost:11434");
        assertThat(props.getModel()).isEqualTo("dolphin3:latest");
        assertThat(props.getTimeoutMs()).isEqualTo(20_000L);
        assertThat(props.getTemperature()).isEqualTo(0.3);
        assertThat(props.getMaxTokens()).isEqualTo(500);
    }

    @Test
    void vaultThrottlingIsOffByDefault() {
        VaultProperties props = new VaultProperties();

        assertThat(props.getBcryptStrength()).isEqualTo(10);
        assertThat(props.getMaxFailedAttempts()).isZero();
        assertThat(props.isThrottlingEnabled()).isFalse();
        assertThat(new VaultProperties(null, 5, null).isThrottlingEnabled()).isTrue();
    }
}
