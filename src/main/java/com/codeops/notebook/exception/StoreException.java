package com.codeops.notebook.exception;

import lombok.Getter;

/**
 * Thrown when the relational store fails during an operation. Every step is idempotent,
 * so the caller may retry the whole operation. Maps to HTTP 503 Service Unavailable.
 */
@Getter
public class StoreException extends NotebookException {

    private final OperationStep step;

    /**
     * Creates a new StoreException for the failed step.
     *
     * @param step  the store call that failed
     * @param cause the underlying data access failure
     */
    public StoreException(OperationStep step, Throwable cause) {
        super("Store operation failed at step " + step, cause);
        this.step = step;
    }
}
