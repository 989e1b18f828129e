package com.codeops.notebook.dto.response;

import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.service.NoteAccess;

import java.time.Instant;
import java.util.UUID;

/**
 * A note as seen by one user, tagged with how that user reaches it and the effective permission.
 */
public record NoteViewResponse(
        UUID id,
        UUID ownerId,
        UUID folderId,
        String title,
        String content,
        String color,
        Instant createdAt,
        Instant updatedAt,
        NoteAccess access,
        SharePermission permission
) {}
