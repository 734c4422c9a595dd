package com.vaultwave.backend.download;

import com.vaultwave.backend.media.OutputCodec;
import com.vaultwave.backend.util.AudioUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decides per track whether the requested format needs a transcode.
 *
 * <ul>
 *   <li>ORIGINAL_ZIP ships originals.</li>
 *   <li>MP3 formats reuse an MP3 source whose bit rate already meets the target, and transcode
 *       anything else.</li>
 *   <li>FLAC and WAV are produced from lossless sources only; a lossy source is shipped
 *       unchanged rather than inflated.</li>
 * </ul>
 */
@Component
public class TrackPlanner {

    /**
     * @param localFile  the track's source file, already fetched from storage
     * @param probeBitrate used when the catalog has no bit rate for an MP3 source
     * @throws IllegalArgumentException when the source format is unknown and a conversion is needed
     */
    public TrackPlan plan(TrackSource track, DownloadFormat format, Path localFile,
                          Function<Path, Optional<Integer>> probeBitrate) {
        String sourceExt = sourceExtension(track);
        String base = AudioUtils.trackEntryBase(track.trackNumber(), track.title());

        if (format == DownloadFormat.ORIGINAL_ZIP) {
            return TrackPlan.copy(track, entryName(base, sourceExt));
        }
        if (sourceExt == null || sourceExt.isBlank()) {
            throw new IllegalArgumentException("Track '" + track.title() + "' has an unknown audio format");
        }

        if (format.isLossy()) {
            if ("mp3".equals(sourceExt)) {
                Integer bitrate = track.bitRate();
                if (bitrate == null) {
                    bitrate = probeBitrate.apply(localFile).orElse(null);
                }
                // unknown bit rate on an MP3 is trusted as good enough
                if (bitrate == null || bitrate >= format.reuseThresholdKbps()) {
                    return TrackPlan.copy(track, entryName(base, sourceExt));
                }
            }
            return TrackPlan.transcode(track, OutputCodec.MP3, format.bitrateKbps(), entryName(base, OutputCodec.MP3.extension()));
        }

        OutputCodec target = format.codec();
        if (!track.lossless() || target.extension().equals(sourceExt)) {
            return TrackPlan.copy(track, entryName(base, sourceExt));
        }
        return TrackPlan.transcode(track, target, null, entryName(base, target.extension()));
    }

    static String sourceExtension(TrackSource track) {
        String fromCodec = AudioUtils.extensionForCodec(track.codecName());
        if (fromCodec != null) return fromCodec;
        String fromKey = AudioUtils.extension(track.storageKey());
        return fromKey.isBlank() ? null : fromKey;
    }

    private static String entryName(String base, String ext) {
        return ext == null || ext.isBlank() ? base : base + "." + ext;
    }
}
