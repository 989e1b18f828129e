package com.codeops.notebook.exception;

/**
 * Thrown when a note, folder or user cannot be found, including when it vanished between read and write.
 * Maps to HTTP 404 Not Found.
 */
public class NotFoundException extends NotebookException {

    /**
     * Creates a new NotFoundException with the specified message.
     *
     * @param message the detail message
     */
    public NotFoundException(String message) {
        super(message);
    }
}
