package com.phillippitts.dictavault.service.health;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.testutil.FakeLanguageModelClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierHealthIndicatorTest {

    @Test
    void disabledClassifierIsUp() {
        FakeLanguageModelClient client = new FakeLanguageModelClient().available(false);

        Health health = new ClassifierHealthIndicator(client, new ClassifierProperties(false, 1_000)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Classifier disabled");
    }

    @Test
    void reachableClassifierIsUp() {
        FakeLanguageModelClient client = new FakeLanguageModelClient().available(true);

        Health health = new ClassifierHealthIndicator(client, new ClassifierProperties(true, 1_000)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("backend", "fake").containsEntry("model", "dolphin3:latest");
    }

    @Test
    void unreachableClassifierIsDegradedNotDown() {
        FakeLanguageModelClient client = new FakeLanguageModelClient().available(false);

        Health health = new ClassifierHealthIndicator(client, new ClassifierProperties(true, 1_000)).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getStatus()).isNotEqualTo(Status.DOWN);
    }
}
