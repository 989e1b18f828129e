package com.codeops.notebook.editor;

import com.codeops.notebook.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Recovers the local draft once the application has started, then resolves any recovered
 * editing reference on the editor scheduler after the mount tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DraftRecoveryRunner implements ApplicationRunner {

    private final DraftSession draftSession;
    private final NoteRepository noteRepository;
    private final TaskScheduler editorTaskScheduler;

    @Override
    public void run(ApplicationArguments args) {
        RecoveryResult result = draftSession.recover();
        log.info("Draft recovery finished: {} (return to notes: {})", result.outcome(), result.returnToNotes());
        if (result.restored() && draftSession.hasPendingReference()) {
            editorTaskScheduler.schedule(this::resolveReference, editorTaskScheduler.getClock().instant());
        }
    }

    /**
     * A store failure leaves the reference pending, so the draft keeps it for the next start.
     */
    void resolveReference() {
        try {
            draftSession.resolveRecoveredReference(this::lookup);
        } catch (DataAccessException e) {
            log.warn("Could not resolve the recovered note reference: {}", e.getMessage());
        }
    }

    Optional<EditingRef> lookup(UUID noteId) {
        return noteRepository.findById(noteId).map(note -> new EditingRef(note.getId(), note.getTitle()));
    }
}
