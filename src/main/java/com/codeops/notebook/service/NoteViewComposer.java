package com.codeops.notebook.service;

import com.codeops.notebook.entity.Folder;
import com.codeops.notebook.entity.FolderCollaborator;
import com.codeops.notebook.entity.Note;
import com.codeops.notebook.entity.NoteCollaborator;
import com.codeops.notebook.entity.enums.SharePermission;
import com.codeops.notebook.util.MarkupText;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Pure composition of one user's notebook view from the rows that feed it. Nothing here reads
 * the store or keeps state, so a view is recomputed from fresh rows on every call.
 *
 * <p>Notes are classified into four kinds. The owned partition holds notes the user owns outside
 * any shared folder. The shared partition holds notes reached through a note grant, notes in a
 * folder shared with the user, and the user's own notes in folders they have shared. Every note
 * appears once, and all results are ordered newest first with the id as tie-break.</p>
 */
public final class NoteViewComposer {

    static final Comparator<ClassifiedNote> NEWEST_FIRST = Comparator
            .comparing((ClassifiedNote c) -> c.note().getCreatedAt(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(c -> c.note().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private NoteViewComposer() {
    }

    /**
     * The source sets for one user.
     *
     * @param userId               the viewing user
     * @param ownedNotes           notes owned by the user
     * @param sharedOwnedFolderIds ids of the user's folders that have at least one collaborator
     * @param directGrants         note grants naming the user
     * @param directNotes          the notes those grants refer to
     * @param folderGrants         folder grants naming the user
     * @param folderNotes          notes currently filed in those folders
     */
    public record NoteSources(
            UUID userId,
            List<Note> ownedNotes,
            Set<UUID> sharedOwnedFolderIds,
            List<NoteCollaborator> directGrants,
            List<Note> directNotes,
            List<FolderCollaborator> folderGrants,
            List<Note> folderNotes
    ) {
        public static NoteSources empty(UUID userId) {
            return new NoteSources(userId, List.of(), Set.of(), List.of(), List.of(), List.of(), List.of());
        }
    }

    /**
     * A note with the way the viewing user reaches it and the strongest permission they hold.
     */
    public record ClassifiedNote(Note note, NoteAccess access, SharePermission permission) {

        public boolean inOwnedPartition() {
            return access == NoteAccess.OWNED;
        }
    }

    /**
     * Classifies every visible note, de-duplicated by id.
     *
     * @param sources the user's source sets
     * @return all visible notes, newest first
     */
    public static List<ClassifiedNote> classifyNotes(NoteSources sources) {
        Map<UUID, SharePermission> directPermissions = new HashMap<>();
        for (NoteCollaborator grant : sources.directGrants()) {
            directPermissions.merge(grant.getNoteId(), grant.getPermission(), SharePermission::strongest);
        }
        Map<UUID, SharePermission> folderPermissions = new HashMap<>();
        for (FolderCollaborator grant : sources.folderGrants()) {
            folderPermissions.merge(grant.getFolderId(), grant.getPermission(), SharePermission::strongest);
        }

        Map<UUID, ClassifiedNote> byId = new LinkedHashMap<>();
        for (Note note : sources.ownedNotes()) {
            boolean inSharedFolder = note.getFolderId() != null
                    && sources.sharedOwnedFolderIds().contains(note.getFolderId());
            NoteAccess access = inSharedFolder ? NoteAccess.OWNED_IN_SHARED_FOLDER : NoteAccess.OWNED;
            byId.put(note.getId(), new ClassifiedNote(note, access, SharePermission.EDIT));
        }

        List<Note> received = new ArrayList<>(sources.directNotes());
        received.addAll(sources.folderNotes());
        for (Note note : received) {
            if (byId.containsKey(note.getId()) || sources.userId().equals(note.getOwnerId())) {
                continue;
            }
            SharePermission viaFolder = note.getFolderId() == null ? null : folderPermissions.get(note.getFolderId());
            SharePermission direct = directPermissions.get(note.getId());
            SharePermission permission = SharePermission.strongest(direct, viaFolder);
            if (permission == null) {
                continue;
            }
            NoteAccess access = viaFolder != null ? NoteAccess.FOLDER_SHARE : NoteAccess.DIRECT_SHARE;
            byId.put(note.getId(), new ClassifiedNote(note, access, permission));
        }

        List<ClassifiedNote> result = new ArrayList<>(byId.values());
        result.sort(NEWEST_FIRST);
        return result;
    }

    /**
     * Returns one partition of the view.
     *
     * @param sources the user's source sets
     * @param scope   owned, shared, or a single folder
     * @return the selected notes, newest first
     */
    public static List<ClassifiedNote> selectNotes(NoteSources sources, NoteScope scope) {
        List<ClassifiedNote> all = classifyNotes(sources);
        return switch (scope.kind()) {
            case OWNED -> all.stream().filter(ClassifiedNote::inOwnedPartition).toList();
            case SHARED -> all.stream().filter(c -> !c.inOwnedPartition()).toList();
            case FOLDER -> all.stream().filter(c -> scope.folderId().equals(c.note().getFolderId())).toList();
        };
    }

    /**
     * Full-text search over every visible note, matching the title and the plain text of the
     * content without regard to case.
     *
     * @param sources the user's source sets
     * @param query   the search text; a blank query matches everything
     * @return the matching notes, newest first
     */
    public static List<ClassifiedNote> searchNotes(NoteSources sources, String query) {
        List<ClassifiedNote> all = classifyNotes(sources);
        if (query == null || query.isBlank()) {
            return all;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return all.stream()
                .filter(c -> matches(c.note(), needle))
                .toList();
    }

    /**
     * A folder in the view together with the viewer's grant on it.
     *
     * @param folder     the folder
     * @param shared     true when the folder belongs to someone else and is shared with the viewer
     * @param permission the viewer's grant, null for the viewer's own folders
     */
    public record FolderEntry(Folder folder, boolean shared, SharePermission permission) {}

    /**
     * Combines the user's own folders with folders shared with them. The two sets are disjoint
     * because a user can never hold a grant on their own folder.
     *
     * @param ownedFolders  folders owned by the user
     * @param sharedFolders folders the grants refer to
     * @param folderGrants  folder grants naming the user
     * @param order         result order
     * @return the folders
     */
    public static List<FolderEntry> composeFolders(List<Folder> ownedFolders, List<Folder> sharedFolders,
                                                   List<FolderCollaborator> folderGrants, FolderOrder order) {
        Map<UUID, SharePermission> permissions = new HashMap<>();
        for (FolderCollaborator grant : folderGrants) {
            permissions.merge(grant.getFolderId(), grant.getPermission(), SharePermission::strongest);
        }

        Map<UUID, FolderEntry> byId = new LinkedHashMap<>();
        ownedFolders.forEach(folder -> byId.put(folder.getId(), new FolderEntry(folder, false, null)));
        for (Folder folder : sharedFolders) {
            SharePermission permission = permissions.get(folder.getId());
            if (permission != null) {
                byId.putIfAbsent(folder.getId(), new FolderEntry(folder, true, permission));
            }
        }

        List<FolderEntry> result = new ArrayList<>(byId.values());
        result.sort(folderComparator(order));
        return result;
    }

    private static Comparator<FolderEntry> folderComparator(FolderOrder order) {
        Comparator<FolderEntry> byId = Comparator.comparing(e -> e.folder().getId(),
                Comparator.nullsLast(Comparator.naturalOrder()));
        if (order == FolderOrder.NAME) {
            return Comparator.comparing((FolderEntry e) -> e.folder().getName(),
                            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                    .thenComparing(byId);
        }
        Comparator<Instant> newestFirst = Comparator.nullsLast(Comparator.reverseOrder());
        return Comparator.comparing((FolderEntry e) -> e.folder().getCreatedAt(), newestFirst)
                .thenComparing(byId);
    }

    private static boolean matches(Note note, String needle) {
        String title = note.getTitle() == null ? "" : note.getTitle().toLowerCase(Locale.ROOT);
        return title.contains(needle) || MarkupText.containsIgnoreCase(note.getContent(), needle);
    }
}
