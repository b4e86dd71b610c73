package com.phillippitts.dictavault.util;

import org.apache.logging.log4j.ThreadContext;

import java.util.function.Supplier;

/**
 * Scoped Log4j2 ThreadContext (MDC) entries.
 *
 * <p>The key is set for the duration of the action and its previous value is restored
 * afterwards, so nested scopes on the same key behave.
 */
public final class LogContext {

    public static final String SESSION_ID = "sessionId";
    public static final String DOCUMENT_ID = "documentId";

    private LogContext() {}

    public static <T> T with(String key, String value, Supplier<T> action) {
        String previous = ThreadContext.get(key);
        ThreadContext.put(key, value);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(key);
            } else {
                ThreadContext.put(key, previous);
            }
        }
    }
}
