package com.vaultwave.backend.media;

import java.nio.file.Path;

public interface AudioTranscoder {

    /**
     * Encode {@code source} into {@code target} with the given codec.
     *
     * @param bitrateKbps only used by lossy codecs; may be null
     */
    void transcode(Path source, Path target, OutputCodec codec, Integer bitrateKbps) throws TranscodeException;
}
