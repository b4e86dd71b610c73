package com.phillippitts.dictavault.service.detect.llm;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.exception.ClassifierUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaLanguageModelClientTest {

    private static final String BASE_URL = "http://localhost:11434";

    private MockRestServiceServer server;
    private OllamaLanguageModelClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OllamaLanguageModelClient(builder.build(), new ClassifierProperties(true, 1_000));
    }

    @Test
    void generateSendsNonStreamingRequestAndReturnsResponseField() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.model").value("dolphin3:latest"))
                .andExpect(jsonPath("$.prompt").value("hello"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.options.num_predict").value(500))
                .andRespond(withSuccess("{\"model\":\"dolphin3:latest\",\"response\":\"NONE\",\"done\":true}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.generate("hello")).isEqualTo("NONE");
        server.verify();
    }

    @Test
    void missingModelIsReportedAsModelMissing() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.generate("hello"))
                .isInstanceOf(ClassifierUnavailableException.class)
                .extracting(e -> ((ClassifierUnavailableException) e).getReason())
                .isEqualTo("model-missing");
    }

    @Test
    void serverErrorIsReportedAsHttpError() {
        server.expect(requestTo(BASE_URL + "/api/generate")).andRespond(withServerError());

        assertThatThrownBy(() -> client.generate("hello"))
                .isInstanceOf(ClassifierUnavailableException.class)
                .extracting(e -> ((ClassifierUnavailableException) e).getReason())
                .isEqualTo("http-error");
    }

    @Test
    void connectionFailureIsReportedAsUnreachable() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andRespond(request -> {
                    throw new IOException("Connection refused");
                });

        assertThatThrownBy(() -> client.generate("hello"))
                .isInstanceOf(ClassifierUnavailableException.class)
                .extracting(e -> ((ClassifierUnavailableException) e).getReason())
                .isEqualTo("unreachable");
    }

    @Test
    void nonJsonBodyIsMalformed() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.generate("hello"))
                .isInstanceOf(ClassifierUnavailableException.class)
                .extracting(e -> ((ClassifierUnavailableException) e).getReason())
                .isEqualTo("malformed-response");
    }

    @Test
    void extractResponseRequiresResponseField() {
        assertThat(OllamaLanguageModelClient.extractResponse("{\"response\":\"Name|Bob\"}")).isEqualTo("Name|Bob");
        assertThatThrownBy(() -> OllamaLanguageModelClient.extractResponse("{\"done\":true}"))
                .isInstanceOf(ClassifierUnavailableException.class);
        assertThatThrownBy(() -> OllamaLanguageModelClient.extractResponse(""))
                .isInstanceOf(ClassifierUnavailableException.class);
    }

    @Test
    void availabilityProbeNeverThrows() {
        server.expect(requestTo(BASE_URL + "/api/tags")).andRespond(withSuccess("{\"models\":[]}", MediaType.APPLICATION_JSON));
        assertThat(client.isAvailable()).isTrue();

        server.reset();
        server.expect(requestTo(BASE_URL + "/api/tags")).andRespond(withServerError());
        assertThat(client.isAvailable()).isFalse();
    }
}
