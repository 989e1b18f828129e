package com.codeops.notebook.service;

/**
 * How a user reaches a note in the merged view. Computed per query, never stored.
 */
public enum NoteAccess {
    /** The user owns the note and it is unfiled or filed in an unshared folder. */
    OWNED,
    /** The user owns the note and its folder has collaborators. */
    OWNED_IN_SHARED_FOLDER,
    /** The user holds a note grant and no grant on the note's folder. */
    DIRECT_SHARE,
    /** The note sits in a folder shared with the user. */
    FOLDER_SHARE
}
