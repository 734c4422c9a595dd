package com.vaultwave.backend.catalog;

import com.vaultwave.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Data
@ToString(exclude = {"tracks", "artist"})
@EqualsAndHashCode(exclude = {"tracks", "artist"})
@Table(name = "releases")
public class Release {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "artist_id")
    private User artist;

    private boolean published = true;

    private Instant releaseDate;

    @OneToMany(mappedBy = "release")
    @OrderBy("trackNumber ASC, id ASC")
    private List<Track> tracks = new ArrayList<>();

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (releaseDate == null) releaseDate = createdAt;
    }
}
