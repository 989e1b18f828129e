package com.codeops.notebook.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateFolderRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 50) String icon,
        @Size(max = 20) String color
) {}
