package com.codeops.notebook.dto.request;

import jakarta.validation.constraints.Size;

/**
 * Partial update of the open editor; null fields are left unchanged.
 */
public record EditorFieldsRequest(
        @Size(max = 500) String title,
        String body,
        @Size(max = 20) String color
) {}
