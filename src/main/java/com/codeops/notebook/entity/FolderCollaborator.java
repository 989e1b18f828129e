package com.codeops.notebook.entity;

import com.codeops.notebook.entity.enums.SharePermission;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "folder_collaborators",
        uniqueConstraints = @UniqueConstraint(columnNames = {"folder_id", "user_id"}),
        indexes = {
                @Index(name = "idx_folder_collaborators_folder_id", columnList = "folder_id"),
                @Index(name = "idx_folder_collaborators_user_id", columnList = "user_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FolderCollaborator extends BaseEntity {

    @Column(name = "folder_id", nullable = false)
    private UUID folderId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SharePermission permission;

    @Column(name = "invited_by", nullable = false)
    private UUID invitedBy;
}
