package com.codeops.notebook.dto.request;

import com.codeops.notebook.entity.enums.SharePermission;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ShareRequest(
        @NotNull UUID targetUserId,
        @NotNull SharePermission permission
) {}
