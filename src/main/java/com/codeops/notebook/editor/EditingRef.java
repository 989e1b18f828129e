package com.codeops.notebook.editor;

import java.util.UUID;

/**
 * Reference from the editor to the persisted note it is editing.
 *
 * @param id    the note id
 * @param title the note title when it was opened
 */
public record EditingRef(UUID id, String title) {}
