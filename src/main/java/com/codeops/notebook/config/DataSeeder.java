package com.codeops.notebook.config;

import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.UserProfile;
import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.repository.FolderRepository;
import com.codeops.notebook.repository.UserProfileRepository;
import com.codeops.notebook.service.NoteService;
import com.codeops.notebook.service.SharingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds a two-user notebook for development: Alice owns folder "Work" holding note "Plan" and
 * shares the folder with Bob at EDIT. Only runs in the {@code dev} profile and skips if Alice exists.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    static final String ALICE_EMAIL = "alice@codeops.dev";
    static final String BOB_EMAIL = "bob@codeops.dev";

    private final UserProfileRepository userProfileRepository;
    private final FolderRepository folderRepository;
    private final NoteService noteService;
    private final SharingService sharingService;

    @Override
    @Transactional
    public void run(String... args) {
        if (userProfileRepository.findByEmailIgnoreCase(ALICE_EMAIL).isPresent()) {
            log.info("DataSeeder: Data already exists for seed users, skipping.");
            return;
        }

        UserProfile alice = seedUser(ALICE_EMAIL, "Alice");
        UserProfile bob = seedUser(BOB_EMAIL, "Bob");

        Folder work = folderRepository.save(Folder.builder()
                .ownerId(alice.getId())
                .name("Work")
                .icon("briefcase")
                .color("#4A90D9")
                .build());
        noteService.createNote(alice.getId(), new CreateNoteRequest(work.getId(), "Plan", "<p>v1</p>", null));
        sharingService.shareFolder(work.getId(), alice.getId(), bob.getId(), SharePermission.EDIT);

        log.info("DataSeeder: Seeded users alice={} bob={}, folder 'Work' shared with bob",
                alice.getId(), bob.getId());
    }

    private UserProfile seedUser(String email, String displayName) {
        return userProfileRepository.save(UserProfile.builder()
                .email(email)
                .displayName(displayName)
                .build());
    }
}
