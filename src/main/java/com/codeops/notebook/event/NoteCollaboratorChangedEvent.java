package com.codeops.notebook.event;

import java.util.UUID;

/**
 * A NoteCollaborator row for {@code userId} was written or removed. This is the change feed
 * scoped to one user's note grants.
 *
 * @param userId the collaborator whose grant changed
 * @param noteId the note the grant refers to
 * @param type   insert or delete
 */
public record NoteCollaboratorChangedEvent(UUID userId, UUID noteId, ChangeType type) {}
