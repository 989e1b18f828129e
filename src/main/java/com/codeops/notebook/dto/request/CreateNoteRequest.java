package com.codeops.notebook.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record CreateNoteRequest(
        UUID folderId,
        @NotBlank @Size(max = 500) String title,
        String content,
        @Size(max = 20) String color
) {}
