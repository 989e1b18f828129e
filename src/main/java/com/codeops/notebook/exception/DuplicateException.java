package com.codeops.notebook.exception;

/**
 * Thrown when a grant already exists. Informational: the requested state already holds.
 * Maps to HTTP 409 Conflict.
 */
public class DuplicateException extends NotebookException {

    /**
     * Creates a new DuplicateException with the specified message.
     *
     * @param message the detail message
     */
    public DuplicateException(String message) {
        super(message);
    }
}
