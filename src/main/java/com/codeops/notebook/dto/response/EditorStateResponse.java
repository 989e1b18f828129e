package com.codeops.notebook.dto.response;

import com.codeops.notebook.editor.AutosaveState;
import com.codeops.notebook.editor.EditorState;

import java.util.UUID;

public record EditorStateResponse(
        EditorState editorState,
        AutosaveState autosaveState,
        String title,
        String body,
        String color,
        UUID editingNoteId,
        String editingNoteTitle
) {}
