package com.vaultwave.backend.user;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Authenticated account as seen by the acquisition pipeline. Profile data lives elsewhere;
 * only what checkout, library and downloads need is mapped here.
 */
@Entity
@Data
@Table(name = "users")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String displayName;

    @Column(nullable = false, unique = true)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role = Role.USER;

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
