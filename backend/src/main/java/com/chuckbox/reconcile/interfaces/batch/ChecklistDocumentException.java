package com.chuckbox.reconcile.interfaces.batch;

public class ChecklistDocumentException extends RuntimeException {

    public ChecklistDocumentException(String message) {
        super(message);
    }

    public ChecklistDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
