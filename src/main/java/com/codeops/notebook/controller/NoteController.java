package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.request.MoveNoteRequest;
import com.codeops.notebook.dto.request.UpdateNoteRequest;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.dto.response.NoteViewResponse;
import com.codeops.notebook.security.SecurityUtils;
import com.codeops.notebook.service.NoteScope;
import com.codeops.notebook.service.NoteService;
import com.codeops.notebook.service.NotebookViewService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for notes: CRUD, moving between folders, the merged note list and search.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/notes")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Notes", description = "Note CRUD, merged listing and full-text search")
public class NoteController {

    private final NoteService noteService;
    private final NotebookViewService notebookViewService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NoteResponse createNote(@Valid @RequestBody CreateNoteRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Creating note '{}' in folder {} for user {}", request.title(), request.folderId(), userId);
        return noteService.createNote(userId, request);
    }

    /**
     * Lists one partition of the merged note view.
     *
     * @param scope {@code owned-unfiled}, {@code shared}, or a folder id
     * @return the notes, newest first
     */
    @GetMapping
    public List<NoteViewResponse> listNotes(@RequestParam(defaultValue = "owned-unfiled") String scope) {
        return notebookViewService.listNotes(SecurityUtils.getCurrentUserIdOrNull(), NoteScope.parse(scope));
    }

    /**
     * Searches titles and plain-text content of every visible note.
     *
     * @param q the search text
     * @return matching notes, newest first
     */
    @GetMapping("/search")
    public List<NoteViewResponse> searchNotes(@RequestParam String q) {
        return notebookViewService.searchNotes(SecurityUtils.getCurrentUserIdOrNull(), q);
    }

    @GetMapping("/{noteId}")
    public NoteResponse getNote(@PathVariable UUID noteId) {
        return noteService.getNote(noteId, SecurityUtils.getCurrentUserId());
    }

    @PutMapping("/{noteId}")
    public NoteResponse updateNote(@PathVariable UUID noteId,
                                   @Valid @RequestBody UpdateNoteRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Updating note {} for user {}", noteId, userId);
        return noteService.updateNote(noteId, userId, request);
    }

    @PutMapping("/{noteId}/folder")
    public NoteResponse moveNote(@PathVariable UUID noteId, @RequestBody MoveNoteRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Moving note {} to folder {} for user {}", noteId, request.folderId(), userId);
        return noteService.moveNote(noteId, userId, request.folderId());
    }

    @DeleteMapping("/{noteId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteNote(@PathVariable UUID noteId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Deleting note {} for user {}", noteId, userId);
        noteService.deleteNote(noteId, userId);
    }
}
