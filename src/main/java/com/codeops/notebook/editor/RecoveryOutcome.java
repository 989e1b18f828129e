package com.codeops.notebook.editor;

public enum RecoveryOutcome {
    RESTORED,
    NO_DRAFT,
    EXPIRED,
    /** The record was unreadable or not marked open. */
    DISCARDED,
    ALREADY_RAN
}
