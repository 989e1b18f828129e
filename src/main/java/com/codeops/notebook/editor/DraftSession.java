package com.codeops.notebook.editor;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.exception.DraftStorageException;
import com.codeops.notebook.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Crash-safe snapshot of the open editing session.
 *
 * <p>While a note is open the draft record is rewritten on every change. Closing deletes the
 * record; its absence is the only "no draft" state. On restart, {@link #recover()} restores the
 * fields immediately and reopens the editor on the next tick of the mount executor. A recovered
 * reference to a persisted note stays pending until {@link #resolveRecoveredReference(NoteLookup)}
 * confirms the note still exists.</p>
 */
@Slf4j
public class DraftSession {

    private final DraftStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor mountExecutor;
    private final Duration maxAge;

    private final AtomicBoolean recoveryStarted = new AtomicBoolean(false);

    private EditorState state = EditorState.CLOSED;
    private EditorFields fields = EditorFields.EMPTY;
    private EditingRef editingRef;
    private EditingRef pendingRef;
    private boolean awaitingMount;

    public DraftSession(DraftStore store, ObjectMapper objectMapper, Clock clock,
                        Executor mountExecutor, Duration maxAge) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.mountExecutor = mountExecutor;
        this.maxAge = maxAge;
    }

    /**
     * Starts a new, unsaved note.
     *
     * @param color initial color, or null for the default
     */
    public synchronized void startNew(String color) {
        reset();
        state = EditorState.OPEN_UNSAVED;
        fields = new EditorFields("", "", color != null ? color : AppConstants.DEFAULT_NOTE_COLOR);
        persist();
    }

    /**
     * Opens a persisted note for editing.
     *
     * @param ref     the note being edited
     * @param initial the note's current fields
     */
    public synchronized void openExisting(EditingRef ref, EditorFields initial) {
        reset();
        state = EditorState.OPEN_EDITING_EXISTING;
        editingRef = ref;
        fields = initial;
        persist();
    }

    /**
     * Replaces the editor fields and rewrites the draft.
     *
     * @throws ValidationException if no note is open
     */
    public synchronized void update(EditorFields updated) {
        if (!isOpen()) {
            throw new ValidationException("No note is open");
        }
        fields = updated;
        persist();
    }

    /**
     * Binds the open draft to a note that was just created from it.
     */
    public synchronized void attachTo(EditingRef ref) {
        if (!isOpen()) {
            throw new ValidationException("No note is open");
        }
        awaitingMount = false;
        pendingRef = null;
        editingRef = ref;
        state = EditorState.OPEN_EDITING_EXISTING;
        persist();
    }

    /**
     * Drops the link to a note that no longer exists, keeping the text. A later save creates a new note.
     *
     * @param noteId the deleted note
     * @return true if the editor was linked to that note
     */
    public synchronized boolean detachFrom(UUID noteId) {
        boolean linked = editingRef != null && editingRef.id().equals(noteId);
        boolean pending = pendingRef != null && pendingRef.id().equals(noteId);
        if (!linked && !pending) {
            return false;
        }
        editingRef = null;
        pendingRef = null;
        if (state == EditorState.OPEN_EDITING_EXISTING) {
            state = EditorState.OPEN_UNSAVED;
        }
        log.info("Editor detached from deleted note {}", noteId);
        persist();
        return true;
    }

    /**
     * Closes the editor and deletes the draft.
     */
    public synchronized void close() {
        reset();
        state = EditorState.CLOSED;
        fields = EditorFields.EMPTY;
        deleteQuietly(AppConstants.DRAFT_KEY);
        deleteQuietly(AppConstants.WAS_IN_NOTE_KEY);
    }

    /**
     * Restores the last draft. Runs at most once per instance; later calls report {@code ALREADY_RAN}.
     *
     * @return what was found and whether the notes screen should be reopened
     */
    public RecoveryResult recover() {
        if (!recoveryStarted.compareAndSet(false, true)) {
            return new RecoveryResult(RecoveryOutcome.ALREADY_RAN, false);
        }

        Optional<String> raw = readQuietly(AppConstants.DRAFT_KEY);
        if (raw.isEmpty()) {
            log.debug("No draft to recover");
            return new RecoveryResult(RecoveryOutcome.NO_DRAFT, false);
        }

        DraftRecord record;
        try {
            record = objectMapper.readValue(raw.get(), DraftRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable draft: {}", e.getOriginalMessage());
            discardStoredDraft();
            return new RecoveryResult(RecoveryOutcome.DISCARDED, false);
        }
        if (!record.open()) {
            discardStoredDraft();
            return new RecoveryResult(RecoveryOutcome.DISCARDED, false);
        }

        Duration age = Duration.between(Instant.ofEpochMilli(record.timestamp()), clock.instant());
        if (age.compareTo(maxAge) >= 0) {
            log.info("Discarding draft last written {} ago", age);
            discardStoredDraft();
            return new RecoveryResult(RecoveryOutcome.EXPIRED, false);
        }

        boolean returnToNotes = readQuietly(AppConstants.WAS_IN_NOTE_KEY).map("true"::equals).orElse(false);
        synchronized (this) {
            fields = new EditorFields(record.title(), record.body(), record.color());
            pendingRef = record.editingRef();
            editingRef = null;
            awaitingMount = true;
        }
        mountExecutor.execute(this::mountRecovered);
        log.info("Recovered draft '{}' (editing ref: {})", record.title(),
                record.editingRef() != null ? record.editingRef().id() : null);
        return new RecoveryResult(RecoveryOutcome.RESTORED, returnToNotes);
    }

    /**
     * Resolves a recovered editing reference. If the note still exists the editor is linked to it;
     * otherwise the reference is dropped and the draft stays an unsaved note.
     *
     * @param lookup finds notes by id
     * @return true if the editor is now linked to the recovered note
     */
    public boolean resolveRecoveredReference(NoteLookup lookup) {
        EditingRef candidate;
        synchronized (this) {
            candidate = pendingRef;
        }
        if (candidate == null) {
            return false;
        }

        Optional<EditingRef> found = lookup.find(candidate.id());

        synchronized (this) {
            if (pendingRef != candidate) {
                return false;
            }
            pendingRef = null;
            if (found.isPresent()) {
                awaitingMount = false;
                editingRef = found.get();
                state = EditorState.OPEN_EDITING_EXISTING;
                log.info("Recovered draft linked to note {}", candidate.id());
            } else {
                log.info("Recovered draft refers to missing note {}, keeping it as a new note", candidate.id());
            }
            persist();
            return found.isPresent();
        }
    }

    public synchronized EditorState state() {
        return state;
    }

    public synchronized EditorFields currentFields() {
        return fields;
    }

    public synchronized EditingRef editingRef() {
        return editingRef;
    }

    public synchronized boolean hasPendingReference() {
        return pendingRef != null;
    }

    private synchronized void mountRecovered() {
        if (!awaitingMount) {
            return;
        }
        awaitingMount = false;
        state = EditorState.OPEN_UNSAVED;
        log.debug("Recovered draft mounted");
    }

    private boolean isOpen() {
        return state != EditorState.CLOSED || awaitingMount;
    }

    private void reset() {
        editingRef = null;
        pendingRef = null;
        awaitingMount = false;
    }

    private void persist() {
        EditingRef ref = editingRef != null ? editingRef : pendingRef;
        DraftRecord record = new DraftRecord(true, fields.title(), fields.body(), fields.color(), ref, clock.millis());
        try {
            store.set(AppConstants.DRAFT_KEY, objectMapper.writeValueAsString(record));
            store.set(AppConstants.WAS_IN_NOTE_KEY, "true");
        } catch (JsonProcessingException | DraftStorageException e) {
            log.warn("Failed to persist draft: {}", e.getMessage());
        }
    }

    private void discardStoredDraft() {
        deleteQuietly(AppConstants.DRAFT_KEY);
        deleteQuietly(AppConstants.WAS_IN_NOTE_KEY);
    }

    private Optional<String> readQuietly(String key) {
        try {
            return store.get(key);
        } catch (DraftStorageException e) {
            log.warn("Failed to read {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void deleteQuietly(String key) {
        try {
            store.delete(key);
        } catch (DraftStorageException e) {
            log.warn("Failed to delete {}: {}", key, e.getMessage());
        }
    }
}
