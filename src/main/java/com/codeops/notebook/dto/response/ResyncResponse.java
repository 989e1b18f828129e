package com.codeops.notebook.dto.response;

import java.util.UUID;

public record ResyncResponse(UUID folderId, int noteGrantsCreated) {}
