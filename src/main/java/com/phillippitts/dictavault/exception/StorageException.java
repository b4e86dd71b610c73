package com.phillippitts.dictavault.exception;

/**
 * Thrown when a persistence operation fails.
 *
 * <p>Always surfaced to the caller: losing a version or a privacy decision silently is
 * not acceptable.
 */
public class StorageException extends DictaVaultException {

    private final String operation;

    public StorageException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public StorageException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
