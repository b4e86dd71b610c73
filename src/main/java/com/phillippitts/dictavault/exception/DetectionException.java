package com.phillippitts.dictavault.exception;

/**
 * Raised when a detector pattern cannot be compiled.
 *
 * <p>Never aborts a scan: the offending pattern is skipped and the exception is kept
 * for diagnostics.
 */
public class DetectionException extends DictaVaultException {

    private final String patternName;

    public DetectionException(String patternName, Throwable cause) {
        super("Invalid detection pattern '" + patternName + "': "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.patternName = patternName;
    }

    public String getPatternName() {
        return patternName;
    }
}
