package com.vaultwave.backend.util;

import com.mpatric.mp3agic.Mp3File;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

@Slf4j
public class AudioUtils {

    /**
     * Bit rate of an MP3 file in kbps, as reported by mp3agic. Empty if the file cannot be read
     * as MP3.
     */
    public static Optional<Integer> probeMp3Bitrate(Path file) {
        try {
            Mp3File mp3 = new Mp3File(file.toFile());
            int kbps = mp3.getBitrate();
            return kbps > 0 ? Optional.of(kbps) : Optional.empty();
        } catch (Exception e) {
            log.debug("mp3agic could not read {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Map decoder codec names to a file extension; PCM variants are WAV. */
    public static String extensionForCodec(String codecName) {
        if (codecName == null || codecName.isBlank()) return null;
        String c = codecName.toLowerCase(Locale.ROOT);
        if (c.startsWith("pcm_")) return "wav";
        return c;
    }

    public static String sanitizeTitle(String s) {
        if (s == null || s.isBlank()) return "Untitled";
        return s.replaceAll("[^A-Za-z0-9 ._()\\-]", "_").trim();
    }

    /** "03_Title" style entry base, or just the title when there is no track number. */
    public static String trackEntryBase(Integer trackNumber, String title) {
        String safe = sanitizeTitle(title);
        return trackNumber != null ? String.format("%02d_%s", trackNumber, safe) : safe;
    }

    public static String extension(String s) {
        if (s == null) return "";
        int i = s.lastIndexOf('.');
        return i >= 0 ? s.substring(i + 1).toLowerCase(Locale.ROOT) : "";
    }
}
