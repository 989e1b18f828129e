package com.codeops.notebook.editor;

/**
 * @param outcome       what recovery did
 * @param returnToNotes true when the notes screen was open at shutdown and a draft was restored
 */
public record RecoveryResult(RecoveryOutcome outcome, boolean returnToNotes) {

    public boolean restored() {
        return outcome == RecoveryOutcome.RESTORED;
    }
}
