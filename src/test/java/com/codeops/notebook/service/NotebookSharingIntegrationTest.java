package com.codeops.notebook.service;

import com.codeops.notebook.dto.request.CreateFolderRequest;
import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.response.FolderResponse;
import com.codeops.notebook.dto.response.FolderShareResponse;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.dto.response.NoteViewResponse;
import com.codeops.notebook.entity.UserProfile;
import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.event.NotebookRefreshCoordinator;
import com.codeops.notebook.event.RefreshReason;
import com.codeops.notebook.event.Subscription;
import com.codeops.notebook.repository.FolderCollaboratorRepository;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.NoteCollaboratorRepository;
import com.codeops.notebook.repository.NoteRepository;
import com.codeops.notebook.repository.UserProfileRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end sharing flows against the H2 store: folder shares reach existing and later notes,
 * and the owner's plain list stops showing notes filed in shared folders.
 */
@SpringBootTest
@ActiveProfiles("test")
class NotebookSharingIntegrationTest {

    @Autowired FolderService folderService;
    @Autowired NoteService noteService;
    @Autowired SharingService sharingService;
    @Autowired NotebookViewService notebookViewService;
    @Autowired NotebookRefreshCoordinator refreshCoordinator;
    @Autowired TransactionTemplate transactionTemplate;

    @Autowired UserProfileRepository userProfileRepository;
    @Autowired FolderRepository folderRepository;
    @Autowired FolderCollaboratorRepository folderCollaboratorRepository;
    @Autowired NoteRepository noteRepository;
    @Autowired NoteCollaboratorRepository noteCollaboratorRepository;

    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        alice = userProfileRepository.save(UserProfile.builder()
                .email("alice-" + UUID.randomUUID() + "@codeops.dev").displayName("Alice").build()).getId();
        bob = userProfileRepository.save(UserProfile.builder()
                .email("bob-" + UUID.randomUUID() + "@codeops.dev").displayName("Bob").build()).getId();
    }

    @AfterEach
    void tearDown() {
        noteCollaboratorRepository.deleteAll();
        folderCollaboratorRepository.deleteAll();
        noteRepository.deleteAll();
        folderRepository.deleteAll();
        userProfileRepository.deleteAll();
    }

    // ─── Folder share reaches existing notes ───

    @Test
    void shareFolder_existingNoteMovesToSharedView() {
        FolderResponse work = folderService.createFolder(alice, new CreateFolderRequest("Work", null, null));
        NoteResponse plan = noteService.createNote(alice,
                new CreateNoteRequest(work.id(), "Plan", "<p>Q3 roadmap</p>", null));
        List<RefreshReason> bobRefreshes = new ArrayList<>();
        Subscription subscription = refreshCoordinator.subscribe(bob, bobRefreshes::add);

        FolderShareResponse share = sharingService.shareFolder(work.id(), alice, bob, SharePermission.EDIT);
        subscription.close();

        assertThat(share.materializedNoteGrants()).isEqualTo(1);
        assertThat(noteCollaboratorRepository.existsByNoteIdAndUserId(plan.id(), bob)).isTrue();
        assertThat(bobRefreshes).isNotEmpty();

        assertThat(notebookViewService.listNotes(bob, NoteScope.shared()))
                .extracting(NoteViewResponse::title, NoteViewResponse::access, NoteViewResponse::permission)
                .containsExactly(tuple("Plan", NoteAccess.FOLDER_SHARE, SharePermission.EDIT));
        assertThat(notebookViewService.listNotes(alice, NoteScope.owned())).isEmpty();
        assertThat(notebookViewService.listNotes(alice, NoteScope.folder(work.id())))
                .extracting(NoteViewResponse::title, NoteViewResponse::access)
                .containsExactly(tuple("Plan", NoteAccess.OWNED_IN_SHARED_FOLDER));
    }

    // ─── Folder share reaches later notes ───

    @Test
    void createNote_inSharedFolder_isGrantedToCollaborators() {
        FolderResponse work = folderService.createFolder(alice, new CreateFolderRequest("Work", null, null));
        sharingService.shareFolder(work.id(), alice, bob, SharePermission.VIEW);

        NoteResponse draft = noteService.createNote(alice,
                new CreateNoteRequest(work.id(), "Draft2", "<p>later</p>", null));

        assertThat(noteCollaboratorRepository.findByNoteIdAndUserId(draft.id(), bob))
                .hasValueSatisfying(grant -> assertThat(grant.getPermission()).isEqualTo(SharePermission.VIEW));
        assertThat(sharingService.canView(draft.id(), bob)).isTrue();
        assertThat(sharingService.canEdit(draft.id(), bob)).isFalse();
        assertThat(notebookViewService.searchNotes(bob, "LATER"))
                .extracting(NoteViewResponse::id)
                .containsExactly(draft.id());
    }

    @Test
    void unfiledNote_staysOwnedAndPrivate() {
        NoteResponse memo = noteService.createNote(alice, new CreateNoteRequest(null, "Memo", "", null));

        assertThat(notebookViewService.listNotes(alice, NoteScope.owned()))
                .extracting(NoteViewResponse::id, NoteViewResponse::access)
                .containsExactly(tuple(memo.id(), NoteAccess.OWNED));
        assertThat(notebookViewService.listNotes(bob, NoteScope.shared())).isEmpty();
        assertThat(sharingService.canView(memo.id(), bob)).isFalse();
    }

    // ─── Concurrent note grant ───

    @Test
    void insertIfAbsent_pairAlreadyGranted_keepsTransactionUsable() {
        NoteResponse memo = noteService.createNote(alice, new CreateNoteRequest(null, "Memo", "", null));
        sharingService.shareNote(memo.id(), alice, bob, SharePermission.VIEW);

        int inserted = transactionTemplate.execute(status -> {
            int count = noteCollaboratorRepository.insertIfAbsent(UUID.randomUUID(), memo.id(), bob,
                    SharePermission.EDIT.name(), alice, Instant.now());
            assertThat(noteCollaboratorRepository.existsByNoteIdAndUserId(memo.id(), bob)).isTrue();
            return count;
        });

        assertThat(inserted).isZero();
        assertThat(noteCollaboratorRepository.findByNoteId(memo.id()))
                .singleElement()
                .satisfies(grant -> assertThat(grant.getPermission()).isEqualTo(SharePermission.VIEW));
    }
}
