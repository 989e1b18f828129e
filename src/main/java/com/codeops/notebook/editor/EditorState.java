package com.codeops.notebook.editor;

/**
 * Open state of the note editor.
 */
public enum EditorState {
    CLOSED,
    /** A new note, or a recovered draft with no backing note. Saving creates a note. */
    OPEN_UNSAVED,
    /** An existing note is open. Saving updates it and autosave is active. */
    OPEN_EDITING_EXISTING
}
