package com.codeops.notebook.dto.response;

/**
 * Result of a folder share: the new grant and how many per-note grants were materialized with it.
 */
public record FolderShareResponse(
        FolderCollaboratorResponse collaborator,
        int materializedNoteGrants
) {}
