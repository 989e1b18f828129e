package com.codeops.notebook.exception;

/**
 * Thrown when input is empty or self-referential. Raised before any write.
 * Maps to HTTP 400 Bad Request.
 */
public class ValidationException extends NotebookException {

    /**
     * Creates a new ValidationException with the specified message.
     *
     * @param message the detail message
     */
    public ValidationException(String message) {
        super(message);
    }
}
