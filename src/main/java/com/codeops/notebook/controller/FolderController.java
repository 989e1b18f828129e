package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.request.CreateFolderRequest;
import com.codeops.notebook.dto.request.UpdateFolderRequest;
import com.codeops.notebook.dto.response.FolderResponse;
import com.codeops.notebook.dto.response.FolderViewResponse;
import com.codeops.notebook.security.SecurityUtils;
import com.codeops.notebook.service.FolderOrder;
import com.codeops.notebook.service.FolderService;
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
 * REST controller for folders. Listing returns the user's own folders together with the
 * folders shared with them.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/folders")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Folders", description = "Folder CRUD and the merged folder list")
public class FolderController {

    private final FolderService folderService;
    private final NotebookViewService notebookViewService;

    /**
     * Creates a folder owned by the current user.
     *
     * @param request the folder fields
     * @return the created folder
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public FolderResponse createFolder(@Valid @RequestBody CreateFolderRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Creating folder '{}' for user {}", request.name(), userId);
        return folderService.createFolder(userId, request);
    }

    /**
     * Lists owned and shared folders.
     *
     * @param order CREATED_DESC (default) or NAME
     * @return the folders
     */
    @GetMapping
    public List<FolderViewResponse> listFolders(@RequestParam(defaultValue = "CREATED_DESC") FolderOrder order) {
        return notebookViewService.listFolders(SecurityUtils.getCurrentUserIdOrNull(), order);
    }

    @GetMapping("/{folderId}")
    public FolderResponse getFolder(@PathVariable UUID folderId) {
        return folderService.getFolder(folderId, SecurityUtils.getCurrentUserId());
    }

    @PutMapping("/{folderId}")
    public FolderResponse updateFolder(@PathVariable UUID folderId,
                                       @Valid @RequestBody UpdateFolderRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Updating folder {} for user {}", folderId, userId);
        return folderService.updateFolder(folderId, userId, request);
    }

    /**
     * Deletes a folder. Its notes are kept and become unfiled.
     *
     * @param folderId the folder
     */
    @DeleteMapping("/{folderId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteFolder(@PathVariable UUID folderId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Deleting folder {} for user {}", folderId, userId);
        folderService.deleteFolder(folderId, userId);
    }
}
