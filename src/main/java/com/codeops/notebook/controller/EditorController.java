package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.request.EditorFieldsRequest;
import com.codeops.notebook.dto.response.EditorStateResponse;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.editor.NoteEditorSession;
import com.codeops.notebook.security.SecurityUtils;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for the device's note editor session.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/editor")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Editor", description = "Draft-backed note editor with autosave")
public class EditorController {

    private final NoteEditorSession noteEditorSession;

    @GetMapping
    public EditorStateResponse getState() {
        return noteEditorSession.snapshot();
    }

    @PostMapping("/new")
    public EditorStateResponse startNewNote(@RequestParam(required = false) String color) {
        return noteEditorSession.startNewNote(color);
    }

    @PostMapping("/open/{noteId}")
    public EditorStateResponse openNote(@PathVariable UUID noteId) {
        return noteEditorSession.openNote(SecurityUtils.getCurrentUserId(), noteId);
    }

    /**
     * Applies changed fields. Edits of an existing note are autosaved after a quiet period.
     *
     * @param request fields to change; null fields stay as they are
     * @return the editor state
     */
    @PatchMapping("/fields")
    public EditorStateResponse updateFields(@Valid @RequestBody EditorFieldsRequest request) {
        return noteEditorSession.updateFields(SecurityUtils.getCurrentUserId(), request);
    }

    /**
     * Saves now. A draft without a backing note is created, optionally in the given folder.
     *
     * @param folderId folder for a new note
     * @return the saved note
     */
    @PostMapping("/save")
    public NoteResponse save(@RequestParam(required = false) UUID folderId) {
        return noteEditorSession.save(SecurityUtils.getCurrentUserId(), folderId);
    }

    @PostMapping("/close")
    public EditorStateResponse close() {
        return noteEditorSession.close();
    }

    @PostMapping("/sign-out")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void signOut() {
        noteEditorSession.signOut(SecurityUtils.getCurrentUserId());
    }
}
