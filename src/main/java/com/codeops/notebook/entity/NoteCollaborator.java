package com.codeops.notebook.entity;

import com.codeops.notebook.entity.enums.SharePermission;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "note_collaborators",
        uniqueConstraints = @UniqueConstraint(columnNames = {"note_id", "user_id"}),
        indexes = {
                @Index(name = "idx_note_collaborators_note_id", columnList = "note_id"),
                @Index(name = "idx_note_collaborators_user_id", columnList = "user_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NoteCollaborator extends BaseEntity {

    @Column(name = "note_id", nullable = false)
    private UUID noteId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SharePermission permission;

    @Column(name = "invited_by", nullable = false)
    private UUID invitedBy;
}
