package com.codeops.notebook.service;

import com.codeops.notebook.dto.mapper.FolderMapper;
import com.codeops.notebook.dto.request.CreateFolderRequest;
import com.codeops.notebook.dto.request.UpdateFolderRequest;
import com.codeops.notebook.dto.response.FolderResponse;
import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.FolderCollaborator;
import com.codeops.notebook.event.NotebookMutatedEvent;
import com.codeops.notebook.exception.AuthorizationException;
import com.codeops.notebook.exception.NotFoundException;
import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.exception.ValidationException;
import com.codeops.notebook.repository.FolderCollaboratorRepository;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Service for folder CRUD. Folders only group notes: deleting a folder detaches its notes
 * and never deletes them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class FolderService {

    private final FolderRepository folderRepository;
    private final FolderCollaboratorRepository folderCollaboratorRepository;
    private final NoteRepository noteRepository;
    private final FolderMapper folderMapper;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a folder owned by the user.
     *
     * @param ownerId the creating user
     * @param request the folder fields
     * @return the created folder
     * @throws ValidationException if the name is blank
     */
    public FolderResponse createFolder(UUID ownerId, CreateFolderRequest request) {
        requireName(request.name());
        Folder entity = folderMapper.toEntity(request);
        entity.setOwnerId(ownerId);

        Folder saved = StoreCalls.call(OperationStep.INSERT_FOLDER, () -> folderRepository.save(entity));
        log.info("Created folder '{}' for user {}", saved.getName(), ownerId);
        eventPublisher.publishEvent(new NotebookMutatedEvent(Set.of(ownerId), "create-folder"));
        return folderMapper.toResponse(saved);
    }

    /**
     * Gets a folder visible to the user, either owned or shared with them.
     *
     * @param folderId the folder
     * @param userId   the reader
     * @return the folder
     * @throws NotFoundException if the folder does not exist or is not visible to the user
     */
    @Transactional(readOnly = true)
    public FolderResponse getFolder(UUID folderId, UUID userId) {
        Folder folder = findFolder(folderId);
        if (!folder.getOwnerId().equals(userId)
                && !folderCollaboratorRepository.existsByFolderIdAndUserId(folderId, userId)) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        return folderMapper.toResponse(folder);
    }

    /**
     * Updates a folder with partial update semantics. Only non-null fields are applied.
     *
     * @param folderId the folder
     * @param userId   the folder owner
     * @param request  the fields to change
     * @return the updated folder
     * @throws AuthorizationException if the user does not own the folder
     * @throws ValidationException    if a blank name is supplied
     */
    public FolderResponse updateFolder(UUID folderId, UUID userId, UpdateFolderRequest request) {
        Folder folder = findOwnedFolder(folderId, userId);

        if (request.name() != null) {
            requireName(request.name());
            folder.setName(request.name());
        }
        if (request.icon() != null) {
            folder.setIcon(request.icon());
        }
        if (request.color() != null) {
            folder.setColor(request.color());
        }

        Folder saved = StoreCalls.call(OperationStep.UPDATE_FOLDER, () -> folderRepository.save(folder));
        log.info("Updated folder '{}'", saved.getName());
        eventPublisher.publishEvent(new NotebookMutatedEvent(audienceOf(folderId, userId), "update-folder"));
        return folderMapper.toResponse(saved);
    }

    /**
     * Deletes a folder. Its notes are detached first and become unfiled; its folder grants are
     * removed; note grants already materialized from them stay.
     *
     * @param folderId the folder
     * @param userId   the folder owner
     * @throws AuthorizationException if the user does not own the folder
     */
    public void deleteFolder(UUID folderId, UUID userId) {
        Folder folder = findOwnedFolder(folderId, userId);
        Set<UUID> audience = audienceOf(folderId, userId);

        int detached = StoreCalls.call(OperationStep.DETACH_NOTES, () -> noteRepository.detachFromFolder(folderId));
        StoreCalls.run(OperationStep.DELETE_FOLDER_GRANT, () -> folderCollaboratorRepository.deleteByFolderId(folderId));
        StoreCalls.run(OperationStep.DELETE_FOLDER, () -> folderRepository.delete(folder));

        log.info("Deleted folder '{}' ({}), {} note(s) detached", folder.getName(), folderId, detached);
        eventPublisher.publishEvent(new NotebookMutatedEvent(audience, "delete-folder"));
    }

    private Set<UUID> audienceOf(UUID folderId, UUID ownerId) {
        List<FolderCollaborator> grants = StoreCalls.call(OperationStep.READ_GRANTS,
                () -> folderCollaboratorRepository.findByFolderId(folderId));
        Set<UUID> audience = new HashSet<>();
        audience.add(ownerId);
        grants.forEach(grant -> audience.add(grant.getUserId()));
        return audience;
    }

    private Folder findOwnedFolder(UUID folderId, UUID userId) {
        Folder folder = findFolder(folderId);
        if (!folder.getOwnerId().equals(userId)) {
            throw new AuthorizationException("Only the folder owner can change it");
        }
        return folder;
    }

    private Folder findFolder(UUID folderId) {
        return StoreCalls.call(OperationStep.READ_FOLDER, () -> folderRepository.findById(folderId))
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    private void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Folder name must not be blank");
        }
    }
}
