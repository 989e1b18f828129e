package com.codeops.notebook.event;

import java.util.UUID;

public record NoteDeletedEvent(UUID noteId) {}
