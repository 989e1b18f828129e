package com.codeops.notebook.repository;

import com.codeops.notebook.entity.NoteCollaborator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NoteCollaboratorRepository extends JpaRepository<NoteCollaborator, UUID> {

    List<NoteCollaborator> findByNoteId(UUID noteId);

    List<NoteCollaborator> findByUserId(UUID userId);

    Optional<NoteCollaborator> findByNoteIdAndUserId(UUID noteId, UUID userId);

    boolean existsByNoteIdAndUserId(UUID noteId, UUID userId);

    /**
     * Inserts a note grant unless one already exists for the (note, user) pair. A conflicting
     * row leaves the store untouched and does not fail the surrounding transaction.
     *
     * @return 1 if the grant was inserted, 0 if the pair was already granted
     */
    @Modifying
    @Query(value = "insert into note_collaborators (id, note_id, user_id, permission, invited_by, created_at, updated_at) "
            + "values (:id, :noteId, :userId, :permission, :invitedBy, :createdAt, :createdAt) "
            + "on conflict do nothing",
            nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("noteId") UUID noteId,
                       @Param("userId") UUID userId,
                       @Param("permission") String permission,
                       @Param("invitedBy") UUID invitedBy,
                       @Param("createdAt") Instant createdAt);
}
