package com.codeops.notebook.service;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.mapper.NoteMapper;
import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.request.UpdateNoteRequest;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.editor.EditingRef;
import com.codeops.notebook.editor.EditorFields;
import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.Note;
import com.codeops.notebook.entity.NoteCollaborator;
import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.event.ChangeType;
import com.codeops.notebook.event.NoteCollaboratorChangedEvent;
import com.codeops.notebook.event.NoteDeletedEvent;
import com.codeops.notebook.event.NotebookMutatedEvent;
import com.codeops.notebook.exception.AuthorizationException;
import com.codeops.notebook.exception.NotFoundException;
import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.exception.ValidationException;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.NoteCollaboratorRepository;
import com.codeops.notebook.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Service for note CRUD. Content is an opaque serialized document and is only changed by the
 * owner or an EDIT collaborator. Notes filed into a shared folder receive grants for all of the
 * folder's collaborators before the operation returns.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class NoteService {

    private final NoteRepository noteRepository;
    private final FolderRepository folderRepository;
    private final NoteCollaboratorRepository noteCollaboratorRepository;
    private final SharingService sharingService;
    private final NoteMapper noteMapper;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a note, optionally inside a folder.
     *
     * @param ownerId the creating user
     * @param request the note fields
     * @return the created note
     * @throws ValidationException    if the title is blank
     * @throws NotFoundException      if the folder does not exist
     * @throws AuthorizationException if the folder belongs to another user
     */
    public NoteResponse createNote(UUID ownerId, CreateNoteRequest request) {
        requireTitle(request.title());
        if (request.folderId() != null) {
            requireOwnedFolder(request.folderId(), ownerId);
        }

        Note note = noteMapper.toEntity(request);
        note.setOwnerId(ownerId);
        note.setContent(request.content() != null ? request.content() : "");
        note.setColor(request.color() != null ? request.color() : AppConstants.DEFAULT_NOTE_COLOR);

        Note saved = StoreCalls.call(OperationStep.INSERT_NOTE, () -> noteRepository.saveAndFlush(note));
        int grants = sharingService.materializeNoteGrants(saved);

        log.info("Created note {} for user {} in folder {} ({} folder grant(s) applied)",
                saved.getId(), ownerId, saved.getFolderId(), grants);
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(ownerId), "create-note"));
        return noteMapper.toResponse(saved);
    }

    /**
     * Reads a note the user can see.
     *
     * @param noteId the note
     * @param userId the reader
     * @return the note
     * @throws NotFoundException if the note does not exist or is not visible to the user
     */
    @Transactional(readOnly = true)
    public NoteResponse getNote(UUID noteId, UUID userId) {
        Note note = findNote(noteId);
        sharingService.requireAccess(note, userId, SharePermission.VIEW);
        return noteMapper.toResponse(note);
    }

    /**
     * Reads a note for the editor; requires edit access.
     *
     * @param noteId the note
     * @param userId the editing user
     * @return the note
     */
    @Transactional(readOnly = true)
    public NoteResponse getNoteForEditing(UUID noteId, UUID userId) {
        Note note = findNote(noteId);
        sharingService.requireAccess(note, userId, SharePermission.EDIT);
        return noteMapper.toResponse(note);
    }

    /**
     * Applies a partial update. Only non-null fields change.
     *
     * @param noteId  the note
     * @param userId  the editing user
     * @param request the fields to change
     * @return the updated note
     * @throws ValidationException    if a blank title is supplied
     * @throws AuthorizationException if the user only has view access
     */
    public NoteResponse updateNote(UUID noteId, UUID userId, UpdateNoteRequest request) {
        Note note = findNote(noteId);
        sharingService.requireAccess(note, userId, SharePermission.EDIT);

        if (request.title() != null) {
            requireTitle(request.title());
            note.setTitle(request.title());
        }
        if (request.content() != null) {
            note.setContent(request.content());
        }
        if (request.color() != null) {
            note.setColor(request.color());
        }

        Note saved = StoreCalls.call(OperationStep.UPDATE_NOTE, () -> noteRepository.save(note));
        log.info("Updated note {} by user {}", noteId, userId);
        eventPublisher.publishEvent(new NotebookMutatedEvent(sharingService.audienceOf(saved), "update-note"));
        return noteMapper.toResponse(saved);
    }

    /**
     * Files a note into a folder, or back to unfiled when {@code folderId} is null.
     * Moving into a shared folder grants the folder's collaborators access to the note.
     *
     * @param noteId   the note
     * @param userId   the note owner
     * @param folderId the target folder, or null
     * @return the moved note
     * @throws AuthorizationException if the user does not own the note or the target folder
     */
    public NoteResponse moveNote(UUID noteId, UUID userId, UUID folderId) {
        Note note = findNote(noteId);
        if (!note.getOwnerId().equals(userId)) {
            throw new AuthorizationException("Only the note owner can move it");
        }
        if (folderId != null) {
            requireOwnedFolder(folderId, userId);
        }
        Set<UUID> previousAudience = sharingService.audienceOf(note);

        note.setFolderId(folderId);
        Note saved = StoreCalls.call(OperationStep.UPDATE_NOTE, () -> noteRepository.saveAndFlush(note));
        int grants = sharingService.materializeNoteGrants(saved);

        log.info("Moved note {} to folder {} ({} folder grant(s) applied)", noteId, folderId, grants);
        Set<UUID> affected = new HashSet<>(previousAudience);
        affected.addAll(sharingService.audienceOf(saved));
        eventPublisher.publishEvent(new NotebookMutatedEvent(affected, "move-note"));
        return noteMapper.toResponse(saved);
    }

    /**
     * Deletes a note together with its collaborator grants.
     *
     * @param noteId the note
     * @param userId the note owner
     * @throws AuthorizationException if the user does not own the note
     */
    public void deleteNote(UUID noteId, UUID userId) {
        Note note = findNote(noteId);
        if (!note.getOwnerId().equals(userId)) {
            throw new AuthorizationException("Only the note owner can delete it");
        }
        Set<UUID> audience = sharingService.audienceOf(note);

        List<NoteCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> noteCollaboratorRepository.findByNoteId(noteId));
        StoreCalls.run(OperationStep.DELETE_NOTE_GRANT, () -> noteCollaboratorRepository.deleteAll(grants));
        StoreCalls.run(OperationStep.DELETE_NOTE, () -> noteRepository.delete(note));

        log.info("Deleted note {} ({} grant(s) removed)", noteId, grants.size());
        grants.forEach(grant -> eventPublisher.publishEvent(
                new NoteCollaboratorChangedEvent(grant.getUserId(), noteId, ChangeType.DELETED)));
        eventPublisher.publishEvent(new NoteDeletedEvent(noteId));
        eventPublisher.publishEvent(new NotebookMutatedEvent(audience, "delete-note"));
    }

    /**
     * Writes the editor's fields to an existing note. Used by the autosave engine.
     *
     * @param noteId the note being edited
     * @param userId the editing user
     * @param fields the editor contents at write time
     * @throws ValidationException if the title is blank
     */
    public void applyAutosave(UUID noteId, UUID userId, EditorFields fields) {
        requireTitle(fields.title());
        Note note = findNote(noteId);
        sharingService.requireAccess(note, userId, SharePermission.EDIT);
        note.setTitle(fields.title());
        note.setContent(fields.body());
        note.setColor(fields.color());
        Note saved = StoreCalls.call(OperationStep.UPDATE_NOTE, () -> noteRepository.save(note));
        log.debug("Autosaved note {}", noteId);
        eventPublisher.publishEvent(new NotebookMutatedEvent(sharingService.audienceOf(saved), "autosave-note"));
    }

    /**
     * Looks up a note for a recovered editor reference, without an access check.
     *
     * @param noteId the referenced note
     * @return the reference, or empty if the note no longer exists
     */
    @Transactional(readOnly = true)
    public Optional<EditingRef> findEditingRef(UUID noteId) {
        return StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findById(noteId))
                .map(note -> new EditingRef(note.getId(), note.getTitle()));
    }

    private Note findNote(UUID noteId) {
        return StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findById(noteId))
                .orElseThrow(() -> new NotFoundException("Note not found: " + noteId));
    }

    private void requireOwnedFolder(UUID folderId, UUID userId) {
        Folder folder = StoreCalls.call(OperationStep.READ_FOLDER, () -> folderRepository.findById(folderId))
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
        if (!folder.getOwnerId().equals(userId)) {
            throw new AuthorizationException("Only the folder owner can file notes in it");
        }
    }

    private void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Note title must not be blank");
        }
    }
}
