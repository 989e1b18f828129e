package com.codeops.notebook.repository;

import com.codeops.notebook.entity.FolderCollaborator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public interface FolderCollaboratorRepository extends JpaRepository<FolderCollaborator, UUID> {

    List<FolderCollaborator> findByFolderId(UUID folderId);

    List<FolderCollaborator> findByUserId(UUID userId);

    Optional<FolderCollaborator> findByFolderIdAndUserId(UUID folderId, UUID userId);

    boolean existsByFolderIdAndUserId(UUID folderId, UUID userId);

    /**
     * Returns the subset of the given folder ids that have at least one collaborator.
     *
     * @param folderIds candidate folder ids
     * @return ids of the shared folders among them
     */
    @Query("select distinct fc.folderId from FolderCollaborator fc where fc.folderId in :folderIds")
    Set<UUID> findSharedFolderIds(@Param("folderIds") Collection<UUID> folderIds);

    void deleteByFolderId(UUID folderId);
}
