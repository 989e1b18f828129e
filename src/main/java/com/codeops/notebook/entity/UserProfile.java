package com.codeops.notebook.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "profiles",
        uniqueConstraints = @UniqueConstraint(columnNames = {"email"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile extends BaseEntity {

    @Column(nullable = false, length = 320)
    private String email;

    @Column(name = "display_name", length = 200)
    private String displayName;
}
