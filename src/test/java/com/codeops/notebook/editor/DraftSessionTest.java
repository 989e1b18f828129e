package com.codeops.notebook.editor;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DraftSessionTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private static final Duration MAX_AGE = Duration.ofHours(24);
    private static final UUID NOTE_ID = UUID.randomUUID();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryDraftStore store;
    private ManualTaskScheduler scheduler;
    private DraftSession session;

    @BeforeEach
    void setUp() {
        store = new InMemoryDraftStore();
        scheduler = new ManualTaskScheduler(NOW);
        session = newSession();
    }

    // ─── Persist Tests ───

    @Test
    void startNew_writesDraftWithDefaultColor() throws Exception {
        session.startNew(null);

        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        DraftRecord record = storedRecord();
        assertThat(record.open()).isTrue();
        assertThat(record.color()).isEqualTo(AppConstants.DEFAULT_NOTE_COLOR);
        assertThat(record.editingRef()).isNull();
        assertThat(record.timestamp()).isEqualTo(NOW.toEpochMilli());
        assertThat(store.values()).containsEntry(AppConstants.WAS_IN_NOTE_KEY, "true");
    }

    @Test
    void storedDraftUsesIsOpenField() {
        session.startNew("#FFEE00");

        assertThat(store.values().get(AppConstants.DRAFT_KEY)).contains("\"isOpen\":true");
    }

    @Test
    void update_rewritesDraft() throws Exception {
        session.openExisting(new EditingRef(NOTE_ID, "Plan"), new EditorFields("Plan", "<p>v1</p>", null));
        session.update(new EditorFields("Plan", "<p>v2</p>", null));

        DraftRecord record = storedRecord();
        assertThat(record.body()).isEqualTo("<p>v2</p>");
        assertThat(record.editingRef()).isEqualTo(new EditingRef(NOTE_ID, "Plan"));
    }

    @Test
    void update_whenClosed_throws() {
        assertThatThrownBy(() -> session.update(new EditorFields("x", "", null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void close_deletesBothKeys() {
        session.startNew(null);

        session.close();

        assertThat(store.values()).isEmpty();
        assertThat(session.state()).isEqualTo(EditorState.CLOSED);
        assertThat(session.currentFields()).isEqualTo(EditorFields.EMPTY);
    }

    @Test
    void storeFailure_doesNotBreakEditing() {
        store.failAll();

        session.startNew(null);
        session.update(new EditorFields("Still editing", "", null));

        assertThat(session.currentFields().title()).isEqualTo("Still editing");
    }

    @Test
    void attachTo_linksCreatedNote() throws Exception {
        session.startNew(null);

        session.attachTo(new EditingRef(NOTE_ID, "Created"));

        assertThat(session.state()).isEqualTo(EditorState.OPEN_EDITING_EXISTING);
        assertThat(storedRecord().editingRef().id()).isEqualTo(NOTE_ID);
    }

    @Test
    void detachFrom_keepsTextAndBecomesUnsaved() throws Exception {
        session.openExisting(new EditingRef(NOTE_ID, "Plan"), new EditorFields("Plan", "<p>v1</p>", null));

        assertThat(session.detachFrom(UUID.randomUUID())).isFalse();
        assertThat(session.detachFrom(NOTE_ID)).isTrue();

        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(session.editingRef()).isNull();
        assertThat(session.currentFields().body()).isEqualTo("<p>v1</p>");
        assertThat(storedRecord().editingRef()).isNull();
    }

    // ─── Recovery Tests ───

    @Test
    void recover_noDraft() {
        assertThat(session.recover()).isEqualTo(new RecoveryResult(RecoveryOutcome.NO_DRAFT, false));
    }

    @Test
    void recover_recentDraft_restoresFieldsThenMountsOnNextTick() throws Exception {
        writeDraft(true, NOW.minus(Duration.ofHours(23)), null);
        store.set(AppConstants.WAS_IN_NOTE_KEY, "true");

        RecoveryResult result = session.recover();

        assertThat(result).isEqualTo(new RecoveryResult(RecoveryOutcome.RESTORED, true));
        assertThat(session.currentFields().title()).isEqualTo("Draft2");
        assertThat(session.state()).isEqualTo(EditorState.CLOSED);

        scheduler.runDue();

        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
    }

    @Test
    void recover_withoutWasInNote_doesNotReturnToNotes() throws Exception {
        writeDraft(true, NOW.minus(Duration.ofMinutes(5)), null);

        assertThat(session.recover().returnToNotes()).isFalse();
    }

    @Test
    void recover_editBeforeMount_isKept() throws Exception {
        writeDraft(true, NOW.minus(Duration.ofMinutes(5)), null);
        session.recover();

        session.update(new EditorFields("Draft2 edited", "", null));
        scheduler.runDue();

        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(session.currentFields().title()).isEqualTo("Draft2 edited");
    }

    @Test
    void recover_draftOlderThanMaxAge_isDiscarded() throws Exception {
        writeDraft(true, NOW.minus(Duration.ofHours(25)), null);
        store.set(AppConstants.WAS_IN_NOTE_KEY, "true");

        RecoveryResult result = session.recover();

        assertThat(result).isEqualTo(new RecoveryResult(RecoveryOutcome.EXPIRED, false));
        assertThat(store.values()).isEmpty();
        scheduler.runDue();
        assertThat(session.state()).isEqualTo(EditorState.CLOSED);
    }

    @Test
    void recover_draftExactlyMaxAge_isDiscarded() throws Exception {
        writeDraft(true, NOW.minus(MAX_AGE), null);

        assertThat(session.recover().outcome()).isEqualTo(RecoveryOutcome.EXPIRED);
    }

    @Test
    void recover_closedRecord_isDiscarded() throws Exception {
        writeDraft(false, NOW, null);

        assertThat(session.recover().outcome()).isEqualTo(RecoveryOutcome.DISCARDED);
        assertThat(store.values()).isEmpty();
    }

    @Test
    void recover_corruptDraft_isDiscarded() {
        store.set(AppConstants.DRAFT_KEY, "{not json");

        assertThat(session.recover().outcome()).isEqualTo(RecoveryOutcome.DISCARDED);
        assertThat(store.values()).doesNotContainKey(AppConstants.DRAFT_KEY);
    }

    @Test
    void recover_runsOnce() throws Exception {
        writeDraft(true, NOW, null);

        assertThat(session.recover().restored()).isTrue();
        assertThat(session.recover().outcome()).isEqualTo(RecoveryOutcome.ALREADY_RAN);
    }

    // ─── Reference Resolution Tests ───

    @Test
    void resolve_existingNote_linksEditor() throws Exception {
        writeDraft(true, NOW, new EditingRef(NOTE_ID, "Plan"));
        session.recover();
        scheduler.runDue();
        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(session.hasPendingReference()).isTrue();

        boolean linked = session.resolveRecoveredReference(id -> Optional.of(new EditingRef(id, "Plan (renamed)")));

        assertThat(linked).isTrue();
        assertThat(session.state()).isEqualTo(EditorState.OPEN_EDITING_EXISTING);
        assertThat(session.editingRef().title()).isEqualTo("Plan (renamed)");
        assertThat(session.hasPendingReference()).isFalse();
    }

    @Test
    void resolve_missingNote_keepsDraftAsNewNote() throws Exception {
        writeDraft(true, NOW, new EditingRef(NOTE_ID, "Plan"));
        session.recover();
        scheduler.runDue();

        boolean linked = session.resolveRecoveredReference(id -> Optional.empty());

        assertThat(linked).isFalse();
        assertThat(session.state()).isEqualTo(EditorState.OPEN_UNSAVED);
        assertThat(session.editingRef()).isNull();
        assertThat(storedRecord().editingRef()).isNull();
    }

    @Test
    void resolve_beforeMount_stillLinks() throws Exception {
        writeDraft(true, NOW, new EditingRef(NOTE_ID, "Plan"));
        session.recover();

        session.resolveRecoveredReference(id -> Optional.of(new EditingRef(id, "Plan")));
        scheduler.runDue();

        assertThat(session.state()).isEqualTo(EditorState.OPEN_EDITING_EXISTING);
    }

    @Test
    void resolve_afterClose_isIgnored() throws Exception {
        writeDraft(true, NOW, new EditingRef(NOTE_ID, "Plan"));
        session.recover();
        session.close();

        assertThat(session.resolveRecoveredReference(id -> Optional.of(new EditingRef(id, "Plan")))).isFalse();
        assertThat(session.state()).isEqualTo(EditorState.CLOSED);
    }

    // ─── Helpers ───

    private DraftSession newSession() {
        return new DraftSession(store, objectMapper, scheduler.clock(), scheduler, MAX_AGE);
    }

    private void writeDraft(boolean open, Instant writtenAt, EditingRef ref) throws Exception {
        DraftRecord record = new DraftRecord(open, "Draft2", "<p>unsaved</p>", "#FFEE00", ref,
                writtenAt.toEpochMilli());
        store.set(AppConstants.DRAFT_KEY, objectMapper.writeValueAsString(record));
    }

    private DraftRecord storedRecord() throws Exception {
        return objectMapper.readValue(store.values().get(AppConstants.DRAFT_KEY), DraftRecord.class);
    }
}
