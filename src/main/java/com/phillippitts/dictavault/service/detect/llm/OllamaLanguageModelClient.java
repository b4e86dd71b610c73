package com.phillippitts.dictavault.service.detect.llm;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.exception.ClassifierUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * {@link LanguageModelClient} for an Ollama server.
 *
 * <p>Uses the non-streaming {@code POST /api/generate} endpoint:
 * <pre>
 * {"model": "...", "prompt": "...", "stream": false,
 *  "options": {"temperature": 0.3, "num_predict": 500}}
 * </pre>
 * and reads the {@code response} field of the answer. {@code GET /api/tags} serves as the
 * availability probe.
 */
@Component
public class OllamaLanguageModelClient implements LanguageModelClient {

    private static final Logger LOG = LogManager.getLogger(OllamaLanguageModelClient.class);

    static final String REASON_UNREACHABLE = "unreachable";
    static final String REASON_MODEL_MISSING = "model-missing";
    static final String REASON_HTTP_ERROR = "http-error";
    static final String REASON_MALFORMED = "malformed-response";

    private final RestClient restClient;
    private final ClassifierProperties props;

    public OllamaLanguageModelClient(@Qualifier("classifierRestClient") RestClient restClient,
                                     ClassifierProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public String generate(String prompt) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        JSONObject body = new JSONObject()
                .put("model", props.getModel())
                .put("prompt", prompt)
                .put("stream", false)
                .put("options", new JSONObject()
                        .put("temperature", props.getTemperature())
                        .put("num_predict", props.getMaxTokens()));

        String raw;
        try {
            raw = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new ClassifierUnavailableException(REASON_MODEL_MISSING,
                        "Model '" + props.getModel() + "' is not installed on the Ollama server", e);
            }
            throw new ClassifierUnavailableException(REASON_HTTP_ERROR,
                    "Ollama returned HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ClassifierUnavailableException(REASON_UNREACHABLE,
                    "Ollama server not reachable at " + props.getBaseUrl(), e);
        } catch (RestClientException e) {
            throw new ClassifierUnavailableException(REASON_HTTP_ERROR, "Ollama request failed", e);
        }
        return extractResponse(raw);
    }

    @Override
    public boolean isAvailable() {
        try {
            restClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            LOG.debug("Ollama availability probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "ollama";
    }

    static String extractResponse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ClassifierUnavailableException(REASON_MALFORMED, "Empty body from Ollama");
        }
        try {
            JSONObject obj = new JSONObject(raw);
            if (!obj.has("response")) {
                throw new ClassifierUnavailableException(REASON_MALFORMED,
                        "Ollama body has no 'response' field");
            }
            return obj.optString("response", "");
        } catch (JSONException e) {
            throw new ClassifierUnavailableException(REASON_MALFORMED, "Ollama body is not JSON", e);
        }
    }
}
