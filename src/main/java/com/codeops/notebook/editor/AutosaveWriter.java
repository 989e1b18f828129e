package com.codeops.notebook.editor;

import java.util.UUID;

/**
 * Writes the editor fields to an existing note. A thrown exception counts as a failed write.
 */
@FunctionalInterface
public interface AutosaveWriter {

    void write(UUID noteId, UUID userId, EditorFields fields);
}
