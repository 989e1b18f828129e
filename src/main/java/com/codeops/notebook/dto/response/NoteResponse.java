package com.codeops.notebook.dto.response;

import java.time.Instant;
import java.util.UUID;

public record NoteResponse(
        UUID id,
        UUID ownerId,
        UUID folderId,
        String title,
        String content,
        String color,
        Instant createdAt,
        Instant updatedAt
) {}
