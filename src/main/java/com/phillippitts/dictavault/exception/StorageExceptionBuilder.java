package com.phillippitts.dictavault.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link StorageException} with contextual identifiers.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw StorageExceptionBuilder.create("Failed to save version")
 *         .operation("saveVersion")
 *         .cause(dataAccessException)
 *         .metadata("documentId", documentId)
 *         .build();
 * </pre>
 *
 * <p>Only identifiers belong in metadata. Document text and detected spans must never be
 * attached, since exception messages end up in logs.
 */
public final class StorageExceptionBuilder {

    private final String message;
    private String operation;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private StorageExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static StorageExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new StorageExceptionBuilder(message);
    }

    /**
     * Sets the name of the storage operation that failed (e.g. "saveVersion").
     */
    public StorageExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     */
    public StorageExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds an identifier to the exception message. Null keys or values are ignored.
     */
    public StorageExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} ({key1}={val1}, ...) (operation: {operation})
     * </pre>
     */
    public StorageException build() {
        String op = operation != null ? operation : "unknown";
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new StorageException(detailed, op, cause);
        }
        return new StorageException(detailed, op);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
