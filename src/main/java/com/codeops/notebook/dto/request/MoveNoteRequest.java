package com.codeops.notebook.dto.request;

import java.util.UUID;

/**
 * Target folder for a note; a null folderId files the note as unfiled.
 */
public record MoveNoteRequest(UUID folderId) {}
