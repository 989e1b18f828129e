package com.codeops.notebook.config;

import java.time.Duration;

/**
 * Application-wide constants for the CodeOps-Notebook service.
 * Centralizes API paths, draft keys and the editor timing defaults.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Base path prefix for all Notebook API endpoints. */
    public static final String API_PREFIX = "/api/v1/notebook";

    /** Service name used in health checks and structured logging. */
    public static final String SERVICE_NAME = "codeops-notebook";

    /** Maximum length of a folder name. */
    public static final int MAX_FOLDER_NAME_LENGTH = 200;

    /** Maximum length of a note title. */
    public static final int MAX_NOTE_TITLE_LENGTH = 500;

    /** Local draft store key holding the serialized in-progress note. */
    public static final String DRAFT_KEY = "note-draft";

    /** Local draft store key marking that the notes screen was open when the process stopped. */
    public static final String WAS_IN_NOTE_KEY = "was-in-note";

    /** Quiet period after the last edit before an autosave write is issued. */
    public static final Duration DEFAULT_AUTOSAVE_DELAY = Duration.ofSeconds(2);

    /** How long the autosave engine reports SAVED before returning to IDLE. */
    public static final Duration DEFAULT_SAVED_DISPLAY = Duration.ofSeconds(2);

    /** Drafts older than this are discarded instead of restored. */
    public static final Duration DEFAULT_DRAFT_MAX_AGE = Duration.ofHours(24);

    /** Default note color applied when a new note is started without one. */
    public static final String DEFAULT_NOTE_COLOR = "#FFFFFF";

    /** SSE emitter timeout for the refresh stream (30 minutes). */
    public static final long EVENT_STREAM_TIMEOUT_MS = 30L * 60 * 1000;
}
