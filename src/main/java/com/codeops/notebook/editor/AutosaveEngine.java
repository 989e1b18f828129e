package com.codeops.notebook.editor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Debounces edits of an already-persisted note into single writes.
 *
 * <p>Each edit re-arms one timer; when it fires the engine writes the fields as they are at that
 * moment. At most one write is in flight: an edit arriving while SAVING is queued as the next
 * PENDING cycle once the write returns. A failed write returns to IDLE without retrying. Every
 * re-arm or {@link #cancel()} bumps a generation counter, and timers or write results from an
 * older generation are ignored.</p>
 *
 * <p>Autosave writes and explicit saves share one write lock, so an explicit save issued while an
 * autosave write is in flight lands after it.</p>
 */
@Slf4j
public class AutosaveEngine {

    private final TaskScheduler scheduler;
    private final AutosaveWriter writer;
    private final Supplier<EditorFields> fieldSource;
    private final Duration delay;
    private final Duration savedDisplay;

    private AutosaveState state = AutosaveState.IDLE;
    private long generation;
    private ScheduledFuture<?> pendingTimer;
    private ScheduledFuture<?> savedTimer;
    private UUID noteId;
    private UUID userId;
    private boolean editedWhileSaving;
    private final ReentrantLock writeLock = new ReentrantLock();

    public AutosaveEngine(TaskScheduler scheduler, AutosaveWriter writer, Supplier<EditorFields> fieldSource,
                          Duration delay, Duration savedDisplay) {
        this.scheduler = scheduler;
        this.writer = writer;
        this.fieldSource = fieldSource;
        this.delay = delay;
        this.savedDisplay = savedDisplay;
    }

    /**
     * Records an edit of the given note. Ignored when there is no note. An edit that leaves the
     * title blank disarms the pending cycle instead of arming one.
     *
     * @param editedNoteId the persisted note being edited
     * @param editorUserId the user making the edit
     */
    public void onEdit(UUID editedNoteId, UUID editorUserId) {
        if (editedNoteId == null) {
            return;
        }
        boolean titled = fieldSource.get().hasTitle();
        synchronized (this) {
            if (!titled) {
                disarm();
                return;
            }
            noteId = editedNoteId;
            userId = editorUserId;
            if (state == AutosaveState.SAVING) {
                editedWhileSaving = true;
                return;
            }
            arm();
        }
    }

    /**
     * Cancels any armed timer and forgets the current cycle. A write already in flight finishes,
     * but its result is discarded.
     */
    public synchronized void cancel() {
        cancelTimers();
        generation++;
        editedWhileSaving = false;
        noteId = null;
        userId = null;
        if (state != AutosaveState.IDLE) {
            log.debug("Autosave cancelled in state {}", state);
        }
        state = AutosaveState.IDLE;
    }

    /**
     * Runs an explicit write of the open note in place of the current autosave cycle. The cycle is
     * cancelled first, and the write waits for an autosave write already in flight to finish.
     *
     * @param write the explicit write
     * @param <T>   the write result
     * @return the result of {@code write}
     */
    public <T> T saveNow(Supplier<T> write) {
        cancel();
        writeLock.lock();
        try {
            return write.get();
        } finally {
            writeLock.unlock();
        }
    }

    public synchronized AutosaveState state() {
        return state;
    }

    private void arm() {
        cancelTimers();
        long armed = ++generation;
        state = AutosaveState.PENDING;
        pendingTimer = scheduler.schedule(() -> fire(armed), scheduler.getClock().instant().plus(delay));
    }

    private void fire(long armed) {
        UUID targetNote;
        UUID targetUser;
        synchronized (this) {
            if (armed != generation || state != AutosaveState.PENDING) {
                return;
            }
            pendingTimer = null;
            state = AutosaveState.SAVING;
            targetNote = noteId;
            targetUser = userId;
        }

        boolean ok;
        writeLock.lock();
        try {
            if (!isCurrent(armed)) {
                return;
            }
            EditorFields snapshot = fieldSource.get();
            if (!snapshot.hasTitle()) {
                log.debug("Skipping autosave of note {} with a blank title", targetNote);
                abandon(armed);
                return;
            }
            ok = write(targetNote, targetUser, snapshot);
        } finally {
            writeLock.unlock();
        }
        complete(armed, ok);
    }

    private boolean write(UUID targetNote, UUID targetUser, EditorFields snapshot) {
        try {
            writer.write(targetNote, targetUser, snapshot);
            return true;
        } catch (RuntimeException e) {
            log.warn("Autosave of note {} failed: {}", targetNote, e.getMessage());
            return false;
        }
    }

    private synchronized boolean isCurrent(long armed) {
        return armed == generation;
    }

    private synchronized void abandon(long armed) {
        if (armed == generation) {
            editedWhileSaving = false;
            state = AutosaveState.IDLE;
        }
    }

    private void disarm() {
        if (state == AutosaveState.PENDING) {
            cancelTimers();
            generation++;
            state = AutosaveState.IDLE;
            log.debug("Autosave disarmed, title is blank");
        } else if (state == AutosaveState.SAVING) {
            editedWhileSaving = false;
        }
    }

    private synchronized void complete(long armed, boolean ok) {
        if (armed != generation) {
            log.debug("Discarding autosave result for a cancelled cycle");
            return;
        }
        if (editedWhileSaving) {
            editedWhileSaving = false;
            arm();
            return;
        }
        if (!ok) {
            state = AutosaveState.IDLE;
            return;
        }
        state = AutosaveState.SAVED;
        savedTimer = scheduler.schedule(() -> clearSaved(armed), scheduler.getClock().instant().plus(savedDisplay));
    }

    private synchronized void clearSaved(long armed) {
        if (armed == generation && state == AutosaveState.SAVED) {
            savedTimer = null;
            state = AutosaveState.IDLE;
        }
    }

    private void cancelTimers() {
        if (pendingTimer != null) {
            pendingTimer.cancel(false);
            pendingTimer = null;
        }
        if (savedTimer != null) {
            savedTimer.cancel(false);
            savedTimer = null;
        }
    }
}
