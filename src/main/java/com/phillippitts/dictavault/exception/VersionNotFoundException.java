package com.phillippitts.dictavault.exception;

/**
 * Thrown when a requested version does not exist for a document.
 * The operation that needed it (typically a restore) is aborted.
 */
public class VersionNotFoundException extends DictaVaultException {

    private final String documentId;
    private final int versionNumber;

    public VersionNotFoundException(String documentId, int versionNumber) {
        super("Version not found: document=" + documentId + ", version=" + versionNumber);
        this.documentId = documentId;
        this.versionNumber = versionNumber;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getVersionNumber() {
        return versionNumber;
    }
}
