package com.codeops.notebook.editor;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.request.EditorFieldsRequest;
import com.codeops.notebook.dto.request.UpdateNoteRequest;
import com.codeops.notebook.dto.response.EditorStateResponse;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.event.NoteDeletedEvent;
import com.codeops.notebook.exception.AuthorizationException;
import com.codeops.notebook.exception.OperationStep;
import com.codeops.notebook.exception.StoreException;
import com.codeops.notebook.exception.ValidationException;
import com.codeops.notebook.service.NoteService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NoteEditorSessionTest {

    private static final Instant START = Instant.parse("2026-03-03T08:00:00Z");
    private static final Duration DELAY = Duration.ofSeconds(2);
    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID NOTE_ID = UUID.randomUUID();
    private static final UUID FOLDER_ID = UUID.randomUUID();

    @Mock
    private NoteService noteService;

    private ManualTaskScheduler scheduler;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryDraftStore store;
    private DraftSession draftSession;
    private NoteEditorSession editor;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler(START);
        store = new InMemoryDraftStore();
        draftSession = new DraftSession(store, objectMapper, scheduler.clock(), scheduler,
                Duration.ofHours(24));
        AutosaveEngine autosaveEngine = new AutosaveEngine(scheduler, noteService::applyAutosave,
                draftSession::currentFields, DELAY, Duration.ofSeconds(2));
        editor = new NoteEditorSession(draftSession, autosaveEngine, noteService);
    }

    // ─── New Note Tests ───

    @Test
    void startNewNote_opensUnsavedEditor() {
        EditorStateResponse state = editor.startNewNote("#FFEE00");

        assertThat(state.editorState()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(state.autosaveState()).isEqualTo(AutosaveState.IDLE);
        assertThat(state.color()).isEqualTo("#FFEE00");
        assertThat(state.editingNoteId()).isNull();
    }

    @Test
    void newNoteEdits_areNeverAutosaved() {
        editor.startNewNote(null);

        editor.updateFields(USER_ID, new EditorFieldsRequest("Draft2", "<p>x</p>", null));
        scheduler.advance(Duration.ofSeconds(10));

        verify(noteService, never()).applyAutosave(any(), any(), any());
        assertThat(editor.snapshot().autosaveState()).isEqualTo(AutosaveState.IDLE);
    }

    @Test
    void save_newNote_createsAndLinks() {
        editor.startNewNote(null);
        editor.updateFields(USER_ID, new EditorFieldsRequest("Draft2", "<p>x</p>", null));
        when(noteService.createNote(eq(USER_ID), any(CreateNoteRequest.class)))
                .thenReturn(buildNote(NOTE_ID, "Draft2"));

        NoteResponse created = editor.save(USER_ID, FOLDER_ID);

        assertThat(created.id()).isEqualTo(NOTE_ID);
        verify(noteService).createNote(USER_ID, new CreateNoteRequest(FOLDER_ID, "Draft2", "<p>x</p>", "#FFFFFF"));
        EditorStateResponse state = editor.snapshot();
        assertThat(state.editorState()).isEqualTo(EditorState.OPEN_EDITING_EXISTING);
        assertThat(state.editingNoteId()).isEqualTo(NOTE_ID);
    }

    @Test
    void save_whenClosed_throws() {
        assertThatThrownBy(() -> editor.save(USER_ID, null))
                .isInstanceOf(ValidationException.class);
    }

    // ─── Existing Note Tests ───

    @Test
    void openNote_thenEdit_autosavesAfterQuietPeriod() {
        openPlan();

        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));
        assertThat(editor.snapshot().autosaveState()).isEqualTo(AutosaveState.PENDING);

        scheduler.advance(DELAY);

        verify(noteService).applyAutosave(NOTE_ID, USER_ID, new EditorFields("Plan", "<p>v2</p>", null));
        assertThat(editor.snapshot().autosaveState()).isEqualTo(AutosaveState.SAVED);
    }

    @Test
    void openNote_withoutEditAccess_leavesEditorClosed() {
        when(noteService.getNoteForEditing(NOTE_ID, USER_ID))
                .thenThrow(new AuthorizationException("View permission does not allow editing"));

        assertThatThrownBy(() -> editor.openNote(USER_ID, NOTE_ID))
                .isInstanceOf(AuthorizationException.class);
        assertThat(editor.snapshot().editorState()).isEqualTo(EditorState.CLOSED);
    }

    @Test
    void save_existingNote_cancelsPendingAutosave() {
        openPlan();
        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));
        when(noteService.updateNote(eq(NOTE_ID), eq(USER_ID), any(UpdateNoteRequest.class)))
                .thenReturn(buildNote(NOTE_ID, "Plan"));

        editor.save(USER_ID, null);
        scheduler.advance(Duration.ofSeconds(10));

        verify(noteService).updateNote(NOTE_ID, USER_ID, new UpdateNoteRequest("Plan", "<p>v2</p>", null));
        verify(noteService, never()).applyAutosave(any(), any(), any());
    }

    @Test
    void close_cancelsAutosaveAndDeletesDraft() {
        openPlan();
        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));

        editor.close();
        scheduler.advance(Duration.ofSeconds(10));

        verify(noteService, never()).applyAutosave(any(), any(), any());
        assertThat(store.values()).isEmpty();
        assertThat(editor.snapshot().editorState()).isEqualTo(EditorState.CLOSED);
    }

    @Test
    void signOut_cancelsAutosave() {
        openPlan();
        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));

        editor.signOut(USER_ID);
        scheduler.advance(Duration.ofSeconds(10));

        verify(noteService, never()).applyAutosave(any(), any(), any());
    }

    @Test
    void onNoteDeleted_detachesOpenNoteAndCancelsAutosave() {
        openPlan();
        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));

        editor.onNoteDeleted(new NoteDeletedEvent(NOTE_ID));
        scheduler.advance(Duration.ofSeconds(10));

        verify(noteService, never()).applyAutosave(any(), any(), any());
        EditorStateResponse state = editor.snapshot();
        assertThat(state.editorState()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(state.body()).isEqualTo("<p>v2</p>");
        assertThat(state.editingNoteId()).isNull();
    }

    @Test
    void onNoteDeleted_otherNote_keepsAutosave() {
        openPlan();
        editor.updateFields(USER_ID, new EditorFieldsRequest(null, "<p>v2</p>", null));

        editor.onNoteDeleted(new NoteDeletedEvent(UUID.randomUUID()));

        assertThat(editor.snapshot().autosaveState()).isEqualTo(AutosaveState.PENDING);
    }

    // ─── Recovered Draft Tests ───

    @Test
    void save_recoveredDraftOfExistingNote_updatesIt() throws Exception {
        recoverDraftOf(NOTE_ID);
        when(noteService.findEditingRef(NOTE_ID)).thenReturn(Optional.of(new EditingRef(NOTE_ID, "Plan")));
        when(noteService.updateNote(eq(NOTE_ID), eq(USER_ID), any(UpdateNoteRequest.class)))
                .thenReturn(buildNote(NOTE_ID, "Draft2"));

        editor.save(USER_ID, FOLDER_ID);

        verify(noteService).updateNote(NOTE_ID, USER_ID, new UpdateNoteRequest("Draft2", "<p>unsaved</p>", "#FFEE00"));
        verify(noteService, never()).createNote(any(), any());
        assertThat(editor.snapshot().editingNoteId()).isEqualTo(NOTE_ID);
    }

    @Test
    void save_recoveredReferenceLookupFails_createsNothing() throws Exception {
        recoverDraftOf(NOTE_ID);
        when(noteService.findEditingRef(NOTE_ID)).thenThrow(
                new StoreException(OperationStep.READ_NOTE, new DataAccessResourceFailureException("connection reset")));

        assertThatThrownBy(() -> editor.save(USER_ID, FOLDER_ID))
                .isInstanceOf(StoreException.class);

        verify(noteService, never()).createNote(any(), any());
        verify(noteService, never()).updateNote(any(), any(), any());
        assertThat(draftSession.hasPendingReference()).isTrue();
    }

    @Test
    void save_recoveredReferenceToDeletedNote_createsNewNote() throws Exception {
        UUID createdId = UUID.randomUUID();
        recoverDraftOf(NOTE_ID);
        when(noteService.findEditingRef(NOTE_ID)).thenReturn(Optional.empty());
        when(noteService.createNote(eq(USER_ID), any(CreateNoteRequest.class)))
                .thenReturn(buildNote(createdId, "Draft2"));

        editor.save(USER_ID, FOLDER_ID);

        verify(noteService).createNote(USER_ID,
                new CreateNoteRequest(FOLDER_ID, "Draft2", "<p>unsaved</p>", "#FFEE00"));
        assertThat(editor.snapshot().editingNoteId()).isEqualTo(createdId);
    }

    // ─── Helpers ───

    private void recoverDraftOf(UUID noteId) throws Exception {
        DraftRecord record = new DraftRecord(true, "Draft2", "<p>unsaved</p>", "#FFEE00",
                new EditingRef(noteId, "Plan"), START.toEpochMilli());
        store.set(AppConstants.DRAFT_KEY, objectMapper.writeValueAsString(record));
        draftSession.recover();
        scheduler.runDue();
    }

    private void openPlan() {
        when(noteService.getNoteForEditing(NOTE_ID, USER_ID)).thenReturn(buildNote(NOTE_ID, "Plan"));
        editor.openNote(USER_ID, NOTE_ID);
    }

    private NoteResponse buildNote(UUID id, String title) {
        return new NoteResponse(id, USER_ID, null, title, "<p>v1</p>", null, START, START);
    }
}
