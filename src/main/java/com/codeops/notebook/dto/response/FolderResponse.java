package com.codeops.notebook.dto.response;

import java.time.Instant;
import java.util.UUID;

public record FolderResponse(
        UUID id,
        UUID ownerId,
        String name,
        String icon,
        String color,
        Instant createdAt,
        Instant updatedAt
) {}
