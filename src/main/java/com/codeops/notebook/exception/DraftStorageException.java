package com.codeops.notebook.exception;

/**
 * Thrown when the device-local draft store cannot be read or written.
 */
public class DraftStorageException extends NotebookException {

    public DraftStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
