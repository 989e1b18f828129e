package com.codeops.notebook.repository;

import com.codeops.notebook.entity.Note;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface NoteRepository extends JpaRepository<Note, UUID> {

    List<Note> findByOwnerId(UUID ownerId);

    List<Note> findByFolderId(UUID folderId);

    List<Note> findByFolderIdIn(Collection<UUID> folderIds);

    /**
     * Clears the folder reference of every note filed in the given folder.
     *
     * @param folderId the folder being emptied
     * @return the number of notes detached
     */
    @Modifying
    @Query("update Note n set n.folderId = null where n.folderId = :folderId")
    int detachFromFolder(@Param("folderId") UUID folderId);
}
