package com.codeops.notebook.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * A note. {@code folderId} is a weak reference: folders never own the notes filed in them,
 * so deleting a folder detaches its notes instead of removing them.
 */
@Entity
@Table(name = "notes",
        indexes = {
                @Index(name = "idx_notes_owner_id", columnList = "owner_id"),
                @Index(name = "idx_notes_folder_id", columnList = "folder_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Note extends BaseEntity {

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "folder_id")
    private UUID folderId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(length = 20)
    private String color;
}
