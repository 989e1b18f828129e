package com.codeops.notebook.dto.request;

import jakarta.validation.constraints.Size;

public record UpdateNoteRequest(
        @Size(max = 500) String title,
        String content,
        @Size(max = 20) String color
) {}
