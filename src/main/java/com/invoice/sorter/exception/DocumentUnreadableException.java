package com.invoice.sorter.exception;

/**
 * The text extraction step could not produce any lines for a document.
 */
public class DocumentUnreadableException extends RuntimeException {

    private final String documentId;

    public DocumentUnreadableException(String documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public DocumentUnreadableException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
