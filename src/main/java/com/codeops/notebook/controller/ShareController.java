package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.request.ShareRequest;
import com.codeops.notebook.dto.response.FolderCollaboratorResponse;
import com.codeops.notebook.dto.response.FolderShareResponse;
import com.codeops.notebook.dto.response.NoteCollaboratorResponse;
import com.codeops.notebook.dto.response.ResyncResponse;
import com.codeops.notebook.security.SecurityUtils;
import com.codeops.notebook.service.SharingService;
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
 * REST controller for folder and note collaborators. Sharing an already-shared target answers
 * 409 and changes nothing.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Shares", description = "Folder and note collaborators")
public class ShareController {

    private final SharingService sharingService;

    /**
     * Shares a folder and every note in it.
     *
     * @param folderId the folder
     * @param request  target user and permission
     * @return the folder grant and the number of note grants created with it
     */
    @PostMapping("/folders/{folderId}/collaborators")
    @ResponseStatus(HttpStatus.CREATED)
    public FolderShareResponse shareFolder(@PathVariable UUID folderId,
                                           @Valid @RequestBody ShareRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Sharing folder {} with user {} at {}", folderId, request.targetUserId(), request.permission());
        return sharingService.shareFolder(folderId, userId, request.targetUserId(), request.permission());
    }

    @GetMapping("/folders/{folderId}/collaborators")
    public List<FolderCollaboratorResponse> getFolderCollaborators(@PathVariable UUID folderId) {
        return sharingService.getFolderCollaborators(folderId, SecurityUtils.getCurrentUserId());
    }

    @DeleteMapping("/folders/{folderId}/collaborators/{targetUserId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unshareFolder(@PathVariable UUID folderId, @PathVariable UUID targetUserId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Removing user {} from folder {}", targetUserId, folderId);
        sharingService.unshareFolder(folderId, userId, targetUserId);
    }

    /**
     * Recreates missing note grants for the folder's collaborators.
     *
     * @param folderId the folder
     * @return how many note grants were created
     */
    @PostMapping("/folders/{folderId}/collaborators/resync")
    public ResyncResponse resyncFolderGrants(@PathVariable UUID folderId) {
        int created = sharingService.resyncFolderGrants(folderId, SecurityUtils.getCurrentUserId());
        return new ResyncResponse(folderId, created);
    }

    @PostMapping("/notes/{noteId}/collaborators")
    @ResponseStatus(HttpStatus.CREATED)
    public NoteCollaboratorResponse shareNote(@PathVariable UUID noteId,
                                              @Valid @RequestBody ShareRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Sharing note {} with user {} at {}", noteId, request.targetUserId(), request.permission());
        return sharingService.shareNote(noteId, userId, request.targetUserId(), request.permission());
    }

    @GetMapping("/notes/{noteId}/collaborators")
    public List<NoteCollaboratorResponse> getNoteCollaborators(@PathVariable UUID noteId) {
        return sharingService.getNoteCollaborators(noteId, SecurityUtils.getCurrentUserId());
    }

    @DeleteMapping("/notes/{noteId}/collaborators/{targetUserId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unshareNote(@PathVariable UUID noteId, @PathVariable UUID targetUserId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Removing user {} from note {}", targetUserId, noteId);
        sharingService.unshareNote(noteId, userId, targetUserId);
    }
}
