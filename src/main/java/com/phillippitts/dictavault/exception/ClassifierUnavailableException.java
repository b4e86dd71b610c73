package com.phillippitts.dictavault.exception;

/**
 * Thrown when the external language-model classifier cannot produce an answer
 * (server down, HTTP error, unknown model, malformed body).
 *
 * <p>Detection code recovers from this locally and falls back to rule-based matches.
 */
public class ClassifierUnavailableException extends DictaVaultException {

    private final String reason;

    public ClassifierUnavailableException(String reason, String message) {
        super(message + " (reason: " + reason + ")");
        this.reason = reason;
    }

    public ClassifierUnavailableException(String reason, String message, Throwable cause) {
        super(message + " (reason: " + reason + ")", cause);
        this.reason = reason;
    }

    /**
     * Short machine-friendly failure reason, used as a metric tag.
     */
    public String getReason() {
        return reason;
    }
}
