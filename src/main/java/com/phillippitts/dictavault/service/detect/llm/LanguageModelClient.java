package com.phillippitts.dictavault.service.detect.llm;

import com.phillippitts.dictavault.exception.ClassifierUnavailableException;

/**
 * Contract for a text-generation backend used as an extra privacy signal.
 *
 * <p>Implementations wrap a concrete model server (a local Ollama instance by default) behind a
 * single blocking call. Callers are expected to run {@link #generate(String)} off the caller
 * thread with a timeout; see {@link LlmPrivacyClassifier}.
 *
 * <p>Thread Safety: Implementations must be safe for concurrent calls.
 */
public interface LanguageModelClient {

    /**
     * Sends a prompt and returns the model's complete answer.
     *
     * @param prompt full prompt text
     * @return generated text, never null
     * @throws ClassifierUnavailableException if the server cannot be reached, answers with an
     *                                        error status, or returns an unreadable body
     */
    String generate(String prompt);

    /**
     * Checks whether the backend is reachable. Must not throw.
     */
    boolean isAvailable();

    /**
     * Returns a short backend name for logging and metrics (e.g. "ollama").
     */
    String getName();
}
