package com.codeops.notebook.dto.response;

import com.codeops.notebook.entity.enums.SharePermission;

import java.time.Instant;
import java.util.UUID;

public record FolderCollaboratorResponse(
        UUID id,
        UUID folderId,
        UUID userId,
        SharePermission permission,
        UUID invitedBy,
        Instant createdAt
) {}
