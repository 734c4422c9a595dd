package com.vaultwave.backend.download;

import com.vaultwave.backend.catalog.Track;

/**
 * Detached snapshot of the track fields the worker needs, read once before packaging starts.
 */
public record TrackSource(
        Long id,
        String title,
        Integer trackNumber,
        String storageKey,
        String codecName,
        Integer bitRate,
        boolean lossless
) {
    public static TrackSource from(Track track) {
        return new TrackSource(
                track.getId(),
                track.getTitle(),
                track.getTrackNumber(),
                track.getAudioFilePath(),
                track.getCodecName(),
                track.getBitRate(),
                track.isLossless()
        );
    }
}
