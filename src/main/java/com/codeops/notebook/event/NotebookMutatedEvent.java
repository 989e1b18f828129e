package com.codeops.notebook.event;

import java.util.Set;
import java.util.UUID;

/**
 * Published when a local mutation completes.
 *
 * @param affectedUserIds users whose merged view may have changed
 * @param action          short name of the mutation, for logging
 */
public record NotebookMutatedEvent(Set<UUID> affectedUserIds, String action) {}
