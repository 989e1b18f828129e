package com.codeops.notebook.editor;

import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.request.EditorFieldsRequest;
import com.codeops.notebook.dto.request.UpdateNoteRequest;
import com.codeops.notebook.dto.response.EditorStateResponse;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.event.NoteDeletedEvent;
import com.codeops.notebook.exception.ValidationException;
import com.codeops.notebook.service.NoteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.UUID;

/**
 * The device's note editor. Field changes go to the draft first; while an existing note is open
 * they also feed the autosave engine. Closing, signing out or deleting the open note cancels
 * any armed autosave.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoteEditorSession {

    private final DraftSession draftSession;
    private final AutosaveEngine autosaveEngine;
    private final NoteService noteService;

    public EditorStateResponse startNewNote(String color) {
        autosaveEngine.cancel();
        draftSession.startNew(color);
        log.info("Started a new note");
        return snapshot();
    }

    /**
     * Opens a persisted note. Requires edit access.
     *
     * @param userId the editing user
     * @param noteId the note to open
     * @return the editor state
     */
    public EditorStateResponse openNote(UUID userId, UUID noteId) {
        NoteResponse note = noteService.getNoteForEditing(noteId, userId);
        autosaveEngine.cancel();
        draftSession.openExisting(new EditingRef(note.id(), note.title()),
                new EditorFields(note.title(), note.content(), note.color()));
        log.info("Opened note {} for editing", noteId);
        return snapshot();
    }

    /**
     * Applies the non-null fields of the request to the open note.
     *
     * @param userId  the editing user
     * @param request the changed fields
     * @return the editor state
     * @throws ValidationException if no note is open
     */
    public EditorStateResponse updateFields(UUID userId, EditorFieldsRequest request) {
        EditorFields merged = draftSession.currentFields().merge(request.title(), request.body(), request.color());
        draftSession.update(merged);
        if (draftSession.state() == EditorState.OPEN_EDITING_EXISTING) {
            autosaveEngine.onEdit(draftSession.editingRef().id(), userId);
        }
        return snapshot();
    }

    /**
     * Saves the open note now. A recovered reference that is still unresolved is looked up first,
     * so a draft is only created as a new note once its original is known to be gone. A draft with
     * no backing note is created, optionally in a folder, and the editor then edits the created note.
     *
     * @param userId   the saving user
     * @param folderId folder for a newly created note, ignored for existing notes
     * @return the saved note
     * @throws ValidationException if no note is open or the title is blank
     * @throws com.codeops.notebook.exception.StoreException if the recovered reference cannot be
     *                                                       resolved; the save may be retried
     */
    public NoteResponse save(UUID userId, UUID folderId) {
        EditorState state = draftSession.state();
        if (state == EditorState.CLOSED) {
            throw new ValidationException("No note is open");
        }
        if (draftSession.hasPendingReference()) {
            draftSession.resolveRecoveredReference(noteService::findEditingRef);
        }
        EditorFields fields = draftSession.currentFields();
        EditingRef ref = draftSession.editingRef();

        if (ref == null) {
            NoteResponse created = noteService.createNote(userId,
                    new CreateNoteRequest(folderId, fields.title(), fields.body(), fields.color()));
            draftSession.attachTo(new EditingRef(created.id(), created.title()));
            log.info("Saved draft as new note {}", created.id());
            return created;
        }

        NoteResponse updated = autosaveEngine.saveNow(() -> noteService.updateNote(ref.id(), userId,
                new UpdateNoteRequest(fields.title(), fields.body(), fields.color())));
        log.info("Saved note {}", ref.id());
        return updated;
    }

    public EditorStateResponse close() {
        autosaveEngine.cancel();
        draftSession.close();
        log.info("Editor closed");
        return snapshot();
    }

    /**
     * Ends the session for the signed-out user: timers are cancelled and the draft is removed.
     */
    public void signOut(UUID userId) {
        autosaveEngine.cancel();
        draftSession.close();
        log.info("Editor session ended for user {}", userId);
    }

    public EditorStateResponse snapshot() {
        EditorFields fields = draftSession.currentFields();
        EditingRef ref = draftSession.editingRef();
        return new EditorStateResponse(
                draftSession.state(),
                autosaveEngine.state(),
                fields.title(),
                fields.body(),
                fields.color(),
                ref != null ? ref.id() : null,
                ref != null ? ref.title() : null
        );
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onNoteDeleted(NoteDeletedEvent event) {
        if (draftSession.detachFrom(event.noteId())) {
            autosaveEngine.cancel();
        }
    }
}
