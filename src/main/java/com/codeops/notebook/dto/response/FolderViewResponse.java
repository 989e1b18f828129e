package com.codeops.notebook.dto.response;

import com.codeops.notebook.entity.enums.SharePermission;

import java.time.Instant;
import java.util.UUID;

/**
 * A folder as seen by one user. {@code shared} is true for folders shared with that user;
 * {@code permission} is null for the user's own folders.
 */
public record FolderViewResponse(
        UUID id,
        UUID ownerId,
        String name,
        String icon,
        String color,
        Instant createdAt,
        boolean shared,
        SharePermission permission
) {}
