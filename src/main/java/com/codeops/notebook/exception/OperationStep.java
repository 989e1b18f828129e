package com.codeops.notebook.exception;

/**
 * Individual store calls inside multi-step operations, reported with {@link StoreException}
 * so callers know which step failed.
 */
public enum OperationStep {
    READ_FOLDER,
    READ_NOTE,
    READ_USER,
    READ_GRANTS,
    INSERT_FOLDER,
    UPDATE_FOLDER,
    INSERT_NOTE,
    UPDATE_NOTE,
    INSERT_FOLDER_GRANT,
    INSERT_NOTE_GRANT,
    MATERIALIZE_NOTE_GRANTS,
    DELETE_FOLDER_GRANT,
    DELETE_NOTE_GRANT,
    DETACH_NOTES,
    DELETE_FOLDER,
    DELETE_NOTE
}
