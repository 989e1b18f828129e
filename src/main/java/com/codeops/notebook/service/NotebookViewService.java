package com.codeops.notebook.service;

import com.codeops.notebook.dto.response.FolderViewResponse;
import com.codeops.notebook.dto.response.NoteViewResponse;
import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.FolderCollaborator;
import com.codeops.notebook.entity.Note;
import com.codeops.notebook.entity.NoteCollaborator;
import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.repository.FolderCollaboratorRepository;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.NoteCollaboratorRepository;
import com.codeops.notebook.repository.NoteRepository;
import com.codeops.notebook.service.NoteViewComposer.ClassifiedNote;
import com.codeops.notebook.service.NoteViewComposer.FolderEntry;
import com.codeops.notebook.service.NoteViewComposer.NoteSources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the notebook: loads the source rows for a user and hands them to
 * {@link NoteViewComposer}. Every call reads committed state; nothing is cached.
 * A null user sees an empty notebook.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotebookViewService {

    private final FolderRepository folderRepository;
    private final NoteRepository noteRepository;
    private final FolderCollaboratorRepository folderCollaboratorRepository;
    private final NoteCollaboratorRepository noteCollaboratorRepository;

    /**
     * Lists the user's own folders and the folders shared with them.
     *
     * @param userId the viewing user, may be null
     * @param order  result order
     * @return the folders
     */
    public List<FolderViewResponse> listFolders(UUID userId, FolderOrder order) {
        if (userId == null) {
            return List.of();
        }
        List<Folder> owned = StoreCalls.call(OperationStep.READ_FOLDER,
                () -> folderRepository.findByOwnerIdOrderByCreatedAtDesc(userId));
        List<FolderCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByUserId(userId));
        List<Folder> shared = grants.isEmpty()
                ? List.of()
                : StoreCalls.call(OperationStep.READ_FOLDER, () -> folderRepository.findAllById(
                        grants.stream().map(FolderCollaborator::getFolderId).collect(Collectors.toSet())));

        return NoteViewComposer.composeFolders(owned, shared, grants, order).stream()
                .map(this::toFolderView)
                .toList();
    }

    /**
     * Lists one partition of the user's notes.
     *
     * @param userId the viewing user, may be null
     * @param scope  owned-unfiled, shared, or a folder
     * @return the notes, newest first
     */
    public List<NoteViewResponse> listNotes(UUID userId, NoteScope scope) {
        if (userId == null) {
            return List.of();
        }
        List<NoteViewResponse> notes = NoteViewComposer.selectNotes(loadSources(userId), scope).stream()
                .map(this::toNoteView)
                .toList();
        log.debug("Composed {} note(s) for user {} in scope {}", notes.size(), userId, scope.kind());
        return notes;
    }

    /**
     * Searches every note visible to the user by title and plain-text content.
     *
     * @param userId the viewing user, may be null
     * @param query  the search text
     * @return the matching notes, newest first
     */
    public List<NoteViewResponse> searchNotes(UUID userId, String query) {
        if (userId == null) {
            return List.of();
        }
        return NoteViewComposer.searchNotes(loadSources(userId), query).stream()
                .map(this::toNoteView)
                .toList();
    }

    NoteSources loadSources(UUID userId) {
        List<Note> owned = StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findByOwnerId(userId));
        Set<UUID> ownedFolderIds = owned.stream()
                .map(Note::getFolderId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<UUID> sharedOwnedFolderIds = ownedFolderIds.isEmpty()
                ? Set.of()
                : StoreCalls.call(OperationStep.READ_GRANTS,
                        () -> folderCollaboratorRepository.findSharedFolderIds(ownedFolderIds));

        List<NoteCollaborator> directGrants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> noteCollaboratorRepository.findByUserId(userId));
        Set<UUID> directNoteIds = directGrants.stream()
                .map(NoteCollaborator::getNoteId)
                .collect(Collectors.toSet());
        List<Note> directNotes = directNoteIds.isEmpty()
                ? List.of()
                : StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findAllById(directNoteIds));

        List<FolderCollaborator> folderGrants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByUserId(userId));
        Set<UUID> grantedFolderIds = folderGrants.stream()
                .map(FolderCollaborator::getFolderId)
                .collect(Collectors.toSet());
        List<Note> folderNotes = grantedFolderIds.isEmpty()
                ? List.of()
                : StoreCalls.call(OperationStep.READ_NOTE, () -> noteRepository.findByFolderIdIn(grantedFolderIds));

        return new NoteSources(userId, owned, sharedOwnedFolderIds, directGrants, directNotes,
                folderGrants, folderNotes);
    }

    private NoteViewResponse toNoteView(ClassifiedNote classified) {
        Note note = classified.note();
        return new NoteViewResponse(
                note.getId(),
                note.getOwnerId(),
                note.getFolderId(),
                note.getTitle(),
                note.getContent(),
                note.getColor(),
                note.getCreatedAt(),
                note.getUpdatedAt(),
                classified.access(),
                classified.permission()
        );
    }

    private FolderViewResponse toFolderView(FolderEntry entry) {
        Folder folder = entry.folder();
        return new FolderViewResponse(
                folder.getId(),
                folder.getOwnerId(),
                folder.getName(),
                folder.getIcon(),
                folder.getColor(),
                folder.getCreatedAt(),
                entry.shared(),
                entry.permission()
        );
    }
}
