package com.codeops.notebook.exception;

/**
 * Thrown when a user is not the owner (or a sufficiently privileged collaborator) for an operation.
 * Raised before any write. Maps to HTTP 403 Forbidden.
 */
public class AuthorizationException extends NotebookException {

    /**
     * Creates a new AuthorizationException with the specified message.
     *
     * @param message the detail message
     */
    public AuthorizationException(String message) {
        super(message);
    }
}
