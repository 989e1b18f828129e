package com.codeops.notebook.editor;

public enum AutosaveState {
    IDLE,
    PENDING,
    SAVING,
    SAVED
}
