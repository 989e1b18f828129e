package com.codeops.notebook.service;

import com.codeops.notebook.dto.response.FolderCollaboratorResponse;
import com.codeops.notebook.dto.response.FolderShareResponse;
import com.codeops.notebook.dto.response.NoteCollaboratorResponse;
import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.FolderCollaborator;
import com.codeops.notebook.entity.Note;
import com.codeops.notebook.entity.NoteCollaborator;
import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.event.ChangeType;
import com.codeops.notebook.event.NoteCollaboratorChangedEvent;
import com.codeops.notebook.event.NotebookMutatedEvent;
import com.codeops.notebook.exception.AuthorizationException;
import com.codeops.notebook.exception.DuplicateException;
import com.codeops.notebook.exception.NotFoundException;
import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.exception.ValidationException;
import com.codeops.notebook.repository.FolderCollaboratorRepository;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.NoteCollaboratorRepository;
import com.codeops.notebook.repository.NoteRepository;
import com.codeops.notebook.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Maintains the sharing graph: folder-level and note-level collaborator grants.
 *
 * <p>A folder grant is materialized into one note grant per note currently in the folder, and
 * notes filed into a shared folder later receive grants for every folder collaborator. Removing
 * a folder grant leaves the materialized note grants in place.</p>
 *
 * <p>Ownership is always checked against a fresh read of the folder or note. Each operation runs
 * in one transaction; store failures surface as {@link com.codeops.notebook.exception.StoreException}
 * naming the failed step, and the whole operation may be retried.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class SharingService {

    private final FolderRepository folderRepository;
    private final NoteRepository noteRepository;
    private final FolderCollaboratorRepository folderCollaboratorRepository;
    private final NoteCollaboratorRepository noteCollaboratorRepository;
    private final UserProfileRepository userProfileRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Shares a folder, and every note currently in it, with another user.
     *
     * @param folderId     the folder to share
     * @param granterId    the user performing the share; must own the folder
     * @param targetUserId the user receiving access
     * @param permission   the access level
     * @return the new folder grant and the number of note grants materialized with it
     * @throws NotFoundException      if the folder or the target user does not exist
     * @throws AuthorizationException if the granter does not own the folder
     * @throws ValidationException    if the granter targets themself
     * @throws DuplicateException     if the folder is already shared with the target
     */
    public FolderShareResponse shareFolder(UUID folderId, UUID granterId, UUID targetUserId,
                                           SharePermission permission) {
        Folder folder = findFolder(folderId);
        if (!folder.getOwnerId().equals(granterId)) {
            throw new AuthorizationException("Only the folder owner can share it");
        }
        if (targetUserId.equals(granterId)) {
            throw new ValidationException("Cannot share a folder with yourself");
        }
        requireUser(targetUserId);
        boolean exists = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.existsByFolderIdAndUserId(folderId, targetUserId));
        if (exists) {
            throw new DuplicateException("Folder already shared with this user");
        }

        FolderCollaborator grant = FolderCollaborator.builder()
                .folderId(folderId)
                .userId(targetUserId)
                .permission(permission)
                .invitedBy(granterId)
                .build();
        FolderCollaborator saved = StoreCalls.insert(OperationStep.INSERT_FOLDER_GRANT,
                () -> folderCollaboratorRepository.saveAndFlush(grant),
                () -> new DuplicateException("Folder already shared with this user"));

        List<Note> notes = StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findByFolderId(folderId));
        int materialized = materialize(notes, List.of(saved));

        log.info("Shared folder {} with user {} (permission: {}, note grants: {})",
                folderId, targetUserId, permission, materialized);
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(granterId, targetUserId), "share-folder"));
        return new FolderShareResponse(toResponse(saved), materialized);
    }

    /**
     * Shares a single note with another user.
     *
     * @param noteId       the note to share
     * @param granterId    the user performing the share; must own the note
     * @param targetUserId the user receiving access
     * @param permission   the access level
     * @return the new note grant
     * @throws NotFoundException      if the note or the target user does not exist
     * @throws AuthorizationException if the granter does not own the note
     * @throws ValidationException    if the granter targets themself
     * @throws DuplicateException     if the note is already shared with the target
     */
    public NoteCollaboratorResponse shareNote(UUID noteId, UUID granterId, UUID targetUserId,
                                              SharePermission permission) {
        Note note = findNote(noteId);
        if (!note.getOwnerId().equals(granterId)) {
            throw new AuthorizationException("Only the note owner can share it");
        }
        if (targetUserId.equals(granterId)) {
            throw new ValidationException("Cannot share a note with yourself");
        }
        requireUser(targetUserId);
        boolean exists = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> noteCollaboratorRepository.existsByNoteIdAndUserId(noteId, targetUserId));
        if (exists) {
            throw new DuplicateException("Note already shared with this user");
        }

        NoteCollaborator grant = NoteCollaborator.builder()
                .noteId(noteId)
                .userId(targetUserId)
                .permission(permission)
                .invitedBy(granterId)
                .build();
        NoteCollaborator saved = StoreCalls.insert(OperationStep.INSERT_NOTE_GRANT,
                () -> noteCollaboratorRepository.saveAndFlush(grant),
                () -> new DuplicateException("Note already shared with this user"));

        log.info("Shared note {} with user {} (permission: {})", noteId, targetUserId, permission);
        eventPublisher.publishEvent(new NoteCollaboratorChangedEvent(targetUserId, noteId, ChangeType.INSERTED));
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(granterId, targetUserId), "share-note"));
        return toResponse(saved);
    }

    /**
     * Removes a folder grant. Note grants materialized from it are left untouched.
     * Removing a grant that does not exist is a no-op.
     *
     * @param folderId     the folder
     * @param actorId      the folder owner, the inviting user, or the recipient themself
     * @param targetUserId the collaborator to remove
     * @throws NotFoundException      if the folder does not exist
     * @throws AuthorizationException if the actor may not remove this grant
     */
    public void unshareFolder(UUID folderId, UUID actorId, UUID targetUserId) {
        Folder folder = findFolder(folderId);
        Optional<FolderCollaborator> grant = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByFolderIdAndUserId(folderId, targetUserId));

        boolean allowed = actorId.equals(folder.getOwnerId())
                || actorId.equals(targetUserId)
                || grant.map(g -> actorId.equals(g.getInvitedBy())).orElse(false);
        if (!allowed) {
            throw new AuthorizationException("Only the folder owner or the collaborator can remove this share");
        }
        if (grant.isEmpty()) {
            log.debug("Folder {} is not shared with user {}, nothing to remove", folderId, targetUserId);
            return;
        }

        StoreCalls.run(OperationStep.DELETE_FOLDER_GRANT, () -> folderCollaboratorRepository.delete(grant.get()));
        log.info("Removed user {} from folder {}", targetUserId, folderId);
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(actorId, targetUserId), "unshare-folder"));
    }

    /**
     * Removes a note grant. Removing a grant that does not exist is a no-op.
     *
     * @param noteId       the note
     * @param actorId      the note owner, the inviting user, or the recipient themself
     * @param targetUserId the collaborator to remove
     * @throws NotFoundException      if the note does not exist
     * @throws AuthorizationException if the actor may not remove this grant
     */
    public void unshareNote(UUID noteId, UUID actorId, UUID targetUserId) {
        Note note = findNote(noteId);
        Optional<NoteCollaborator> grant = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> noteCollaboratorRepository.findByNoteIdAndUserId(noteId, targetUserId));

        boolean allowed = actorId.equals(note.getOwnerId())
                || actorId.equals(targetUserId)
                || grant.map(g -> actorId.equals(g.getInvitedBy())).orElse(false);
        if (!allowed) {
            throw new AuthorizationException("Only the note owner or the collaborator can remove this share");
        }
        if (grant.isEmpty()) {
            log.debug("Note {} is not shared with user {}, nothing to remove", noteId, targetUserId);
            return;
        }

        StoreCalls.run(OperationStep.DELETE_NOTE_GRANT, () -> noteCollaboratorRepository.delete(grant.get()));
        log.info("Removed user {} from note {}", targetUserId, noteId);
        eventPublisher.publishEvent(new NoteCollaboratorChangedEvent(targetUserId, noteId, ChangeType.DELETED));
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(actorId, targetUserId), "unshare-note"));
    }

    /**
     * Lists the collaborators of a folder. Visible to the owner and to the collaborators.
     *
     * @param folderId    the folder
     * @param requesterId the user asking
     * @return the folder grants
     * @throws NotFoundException if the folder does not exist or is not visible to the requester
     */
    @Transactional(readOnly = true)
    public List<FolderCollaboratorResponse> getFolderCollaborators(UUID folderId, UUID requesterId) {
        Folder folder = findFolder(folderId);
        List<FolderCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByFolderId(folderId));
        boolean visible = folder.getOwnerId().equals(requesterId)
                || grants.stream().anyMatch(g -> g.getUserId().equals(requesterId));
        if (!visible) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        return grants.stream().map(this::toResponse).toList();
    }

    /**
     * Lists the direct collaborators of a note. Visible to anyone who can view the note.
     *
     * @param noteId      the note
     * @param requesterId the user asking
     * @return the note grants
     * @throws NotFoundException if the note does not exist or is not visible to the requester
     */
    @Transactional(readOnly = true)
    public List<NoteCollaboratorResponse> getNoteCollaborators(UUID noteId, UUID requesterId) {
        Note note = findNote(noteId);
        requireAccess(note, requesterId, SharePermission.VIEW);
        return StoreCalls.call(OperationStep.READ_GRANTS, () -> noteCollaboratorRepository.findByNoteId(noteId))
                .stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Recreates any missing note grants for every collaborator of the folder. Safe to repeat.
     *
     * @param folderId the folder
     * @param ownerId  the folder owner
     * @return the number of note grants created
     * @throws NotFoundException      if the folder does not exist
     * @throws AuthorizationException if the caller does not own the folder
     */
    public int resyncFolderGrants(UUID folderId, UUID ownerId) {
        Folder folder = findFolder(folderId);
        if (!folder.getOwnerId().equals(ownerId)) {
            throw new AuthorizationException("Only the folder owner can resync its shares");
        }
        List<FolderCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByFolderId(folderId));
        List<Note> notes = StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findByFolderId(folderId));
        int created = materialize(notes, grants);
        log.info("Resynced folder {}: {} note grant(s) created", folderId, created);
        if (created > 0) {
            eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(ownerId), "resync-folder"));
        }
        return created;
    }

    /**
     * Gives every current collaborator of the note's folder a matching grant on the note.
     * Called when a note is created in, or moved into, a folder.
     *
     * @param note the persisted note
     * @return the number of note grants created
     */
    public int materializeNoteGrants(Note note) {
        if (note.getFolderId() == null) {
            return 0;
        }
        List<FolderCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByFolderId(note.getFolderId()));
        return materialize(List.of(note), grants);
    }

    /**
     * Resolves the strongest permission a user holds on a note: EDIT for the owner, otherwise
     * the stronger of any direct grant and any grant on the note's folder.
     *
     * @param note   the note
     * @param userId the user
     * @return the effective permission, or null when the user has no access
     */
    @Transactional(readOnly = true)
    public SharePermission effectivePermission(Note note, UUID userId) {
        if (userId == null) {
            return null;
        }
        if (note.getOwnerId().equals(userId)) {
            return SharePermission.EDIT;
        }
        SharePermission direct = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> noteCollaboratorRepository.findByNoteIdAndUserId(note.getId(), userId))
                .map(NoteCollaborator::getPermission)
                .orElse(null);
        SharePermission viaFolder = null;
        if (note.getFolderId() != null) {
            viaFolder = StoreCalls.call(OperationStep.READ_GRANTS,
                    () -> folderCollaboratorRepository.findByFolderIdAndUserId(note.getFolderId(), userId))
                    .map(FolderCollaborator::getPermission)
                    .orElse(null);
        }
        return SharePermission.strongest(direct, viaFolder);
    }

    /**
     * Verifies access to a note. Users without any access get a not-found error so the note's
     * existence is not revealed.
     *
     * @param note     the note
     * @param userId   the user
     * @param required the minimum permission
     * @throws NotFoundException      if the user cannot see the note
     * @throws AuthorizationException if the user can see but not edit the note
     */
    @Transactional(readOnly = true)
    public void requireAccess(Note note, UUID userId, SharePermission required) {
        SharePermission permission = effectivePermission(note, userId);
        if (permission == null) {
            throw new NotFoundException("Note not found: " + note.getId());
        }
        if (!permission.covers(required)) {
            throw new AuthorizationException("You have view-only access to this note");
        }
    }

    @Transactional(readOnly = true)
    public boolean canView(UUID noteId, UUID userId) {
        return StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findById(noteId))
                .map(note -> effectivePermission(note, userId) != null)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public boolean canEdit(UUID noteId, UUID userId) {
        return StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findById(noteId))
                .map(note -> {
                    SharePermission permission = effectivePermission(note, userId);
                    return permission != null && permission.covers(SharePermission.EDIT);
                })
                .orElse(false);
    }

    /**
     * Users who see the note through any grant, plus the owner.
     *
     * @param note the note
     * @return the note's audience
     */
    @Transactional(readOnly = true)
    public Set<UUID> audienceOf(Note note) {
        Set<UUID> audience = new HashSet<>();
        audience.add(note.getOwnerId());
        StoreCalls.call(OperationStep.READ_GRANTS, () -> noteCollaboratorRepository.findByNoteId(note.getId()))
                .forEach(grant -> audience.add(grant.getUserId()));
        if (note.getFolderId() != null) {
            StoreCalls.call(OperationStep.READ_GRANTS,
                            () -> folderCollaboratorRepository.findByFolderId(note.getFolderId()))
                    .forEach(grant -> audience.add(grant.getUserId()));
        }
        return audience;
    }

    /**
     * Inserts one note grant per (note, folder grant) pair that is still missing. The note owner
     * and the inviting user are never targeted. A pair granted concurrently counts as satisfied.
     */
    private int materialize(List<Note> notes, List<FolderCollaborator> folderGrants) {
        int created = 0;
        for (Note note : notes) {
            for (FolderCollaborator folderGrant : folderGrants) {
                UUID target = folderGrant.getUserId();
                if (target.equals(note.getOwnerId()) || target.equals(folderGrant.getInvitedBy())) {
                    continue;
                }
                boolean exists = StoreCalls.call(OperationStep.READ_GRANTS,
                        () -> noteCollaboratorRepository.existsByNoteIdAndUserId(note.getId(), target));
                if (exists) {
                    continue;
                }
                int inserted = StoreCalls.call(OperationStep.MATERIALIZE_NOTE_GRANTS,
                        () -> noteCollaboratorRepository.insertIfAbsent(UUID.randomUUID(), note.getId(), target,
                                folderGrant.getPermission().name(), folderGrant.getInvitedBy(), Instant.now()));
                if (inserted == 0) {
                    log.debug("Note {} already granted to user {}", note.getId(), target);
                    continue;
                }
                created++;
                eventPublisher.publishEvent(
                        new NoteCollaboratorChangedEvent(target, note.getId(), ChangeType.INSERTED));
            }
        }
        return created;
    }

    private Folder findFolder(UUID folderId) {
        return StoreCalls.call(OperationStep.READ_FOLDER, () -> folderRepository.findById(folderId))
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    private Note findNote(UUID noteId) {
        return StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findById(noteId))
                .orElseThrow(() -> new NotFoundException("Note not found: " + noteId));
    }

    private void requireUser(UUID userId) {
        boolean exists = StoreCalls.call(OperationStep.READ_USER, () -> userProfileRepository.existsById(userId));
        if (!exists) {
            throw new NotFoundException("User not found: " + userId);
        }
    }

    private FolderCollaboratorResponse toResponse(FolderCollaborator grant) {
        return new FolderCollaboratorResponse(
                grant.getId(),
                grant.getFolderId(),
                grant.getUserId(),
                grant.getPermission(),
                grant.getInvitedBy(),
                grant.getCreatedAt()
        );
    }

    private NoteCollaboratorResponse toResponse(NoteCollaborator grant) {
        return new NoteCollaboratorResponse(
                grant.getId(),
                grant.getNoteId(),
                grant.getUserId(),
                grant.getPermission(),
                grant.getInvitedBy(),
                grant.getCreatedAt()
        );
    }
}
