package com.vaultwave.backend.download;

import com.vaultwave.backend.media.OutputCodec;

/**
 * What to do with one track: ship the original file, or transcode it.
 */
public record TrackPlan(TrackSource track, OutputCodec codec, Integer bitrateKbps, String entryName) {

    public static TrackPlan copy(TrackSource track, String entryName) {
        return new TrackPlan(track, null, null, entryName);
    }

    public static TrackPlan transcode(TrackSource track, OutputCodec codec, Integer bitrateKbps, String entryName) {
        return new TrackPlan(track, codec, bitrateKbps, entryName);
    }

    public boolean copiesOriginal() {
        return codec == null;
    }
}
