package com.codeops.notebook.exception;

/**
 * Base exception for all CodeOps-Notebook service exceptions.
 * Maps to HTTP 500 Internal Server Error when not caught by a more specific handler.
 */
public class NotebookException extends RuntimeException {

    /**
     * Creates a new NotebookException with the specified message.
     *
     * @param message the detail message
     */
    public NotebookException(String message) {
        super(message);
    }

    /**
     * Creates a new NotebookException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public NotebookException(String message, Throwable cause) {
        super(message, cause);
    }
}
