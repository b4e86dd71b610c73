package com.phillippitts.dictavault.exception;

/**
 * Base exception for all dictavault application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DictaVaultException extends RuntimeException {

    public DictaVaultException(String message) {
        super(message);
    }

    public DictaVaultException(String message, Throwable cause) {
        super(message, cause);
    }

    public DictaVaultException(Throwable cause) {
        super(cause);
    }
}
