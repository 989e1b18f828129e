package com.codeops.notebook.editor;

import com.codeops.notebook.entity.Note;
import com.codeops.notebook.repository.NoteRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DraftRecoveryRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-04T07:30:00Z");
    private static final UUID NOTE_ID = UUID.randomUUID();

    @Mock
    private NoteRepository noteRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ManualTaskScheduler scheduler;
    private InMemoryDraftStore store;
    private DraftSession draftSession;
    private DraftRecoveryRunner runner;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler(NOW);
        store = new InMemoryDraftStore();
        draftSession = new DraftSession(store, objectMapper, scheduler.clock(), scheduler, Duration.ofHours(24));
        runner = new DraftRecoveryRunner(draftSession, noteRepository, scheduler);
    }

    @Test
    void run_linksRecoveredDraftToExistingNote() throws Exception {
        writeDraft(new EditingRef(NOTE_ID, "Plan"));
        Note note = Note.builder().title("Plan").build();
        note.setId(NOTE_ID);
        when(noteRepository.findById(NOTE_ID)).thenReturn(Optional.of(note));

        runner.run(new DefaultApplicationArguments());
        scheduler.runDue();

        assertThat(draftSession.state()).isEqualTo(EditorState.OPEN_EDITING_EXISTING);
        assertThat(draftSession.editingRef()).isEqualTo(new EditingRef(NOTE_ID, "Plan"));
    }

    @Test
    void run_missingNote_keepsDraftUnsaved() throws Exception {
        writeDraft(new EditingRef(NOTE_ID, "Plan"));
        when(noteRepository.findById(NOTE_ID)).thenReturn(Optional.empty());

        runner.run(new DefaultApplicationArguments());
        scheduler.runDue();

        assertThat(draftSession.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(draftSession.hasPendingReference()).isFalse();
    }

    @Test
    void run_storeUnavailable_keepsReferencePending() throws Exception {
        writeDraft(new EditingRef(NOTE_ID, "Plan"));
        when(noteRepository.findById(NOTE_ID)).thenThrow(new DataAccessResourceFailureException("down"));

        runner.run(new DefaultApplicationArguments());
        scheduler.runDue();

        assertThat(draftSession.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(draftSession.hasPendingReference()).isTrue();
    }

    @Test
    void run_noDraft_schedulesNothing() {
        runner.run(new DefaultApplicationArguments());

        assertThat(scheduler.activeTasks()).isZero();
        assertThat(draftSession.state()).isEqualTo(EditorState.CLOSED);
    }

    private void writeDraft(EditingRef ref) throws Exception {
        DraftRecord record = new DraftRecord(true, "Plan", "<p>unsaved</p>", null, ref, NOW.toEpochMilli());
        store.set("note-draft", objectMapper.writeValueAsString(record));
    }
}
