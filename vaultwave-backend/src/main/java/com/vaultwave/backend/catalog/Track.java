package com.vaultwave.backend.catalog;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Entity
@Data
@ToString(exclude = "release")
@EqualsAndHashCode(exclude = "release")
@Table(name = "tracks")
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "release_id")
    private Release release;

    @Column(nullable = false)
    private String title;

    private Integer trackNumber;

    // storage key of the master upload, e.g. "audio/3f2c....wav"
    @Column(length = 512)
    private String audioFilePath;

    // ffprobe codec name of the master (mp3, flac, pcm_s16le, ...)
    @Column(length = 32)
    private String codecName;

    // kbps, null when unknown
    private Integer bitRate;

    private boolean lossless;
}
