package com.codeops.notebook.editor;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a recovered editing reference against the notes that still exist.
 */
@FunctionalInterface
public interface NoteLookup {

    Optional<EditingRef> find(UUID noteId);
}
