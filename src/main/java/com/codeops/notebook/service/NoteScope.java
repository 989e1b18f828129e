package com.codeops.notebook.service;

import com.codeops.notebook.exception.ValidationException;

import java.util.UUID;

/**
 * Which partition of the merged note view to return.
 *
 * @param kind     the partition
 * @param folderId the folder for {@link Kind#FOLDER}, otherwise null
 */
public record NoteScope(Kind kind, UUID folderId) {

    public enum Kind {
        OWNED,
        SHARED,
        FOLDER
    }

    public static NoteScope owned() {
        return new NoteScope(Kind.OWNED, null);
    }

    public static NoteScope shared() {
        return new NoteScope(Kind.SHARED, null);
    }

    public static NoteScope folder(UUID folderId) {
        if (folderId == null) {
            throw new ValidationException("Folder scope requires a folder id");
        }
        return new NoteScope(Kind.FOLDER, folderId);
    }

    /**
     * Parses a scope filter: {@code owned-unfiled} (or {@code owned}), {@code shared}, or a folder id.
     *
     * @param value the raw filter
     * @return the scope
     * @throws ValidationException if the value is none of these
     */
    public static NoteScope parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Note scope must not be blank");
        }
        String trimmed = value.trim();
        if ("owned-unfiled".equalsIgnoreCase(trimmed) || "owned".equalsIgnoreCase(trimmed)) {
            return owned();
        }
        if ("shared".equalsIgnoreCase(trimmed)) {
            return shared();
        }
        try {
            return folder(UUID.fromString(trimmed));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown note scope: " + trimmed);
        }
    }
}
