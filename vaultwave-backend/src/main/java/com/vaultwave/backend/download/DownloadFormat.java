package com.vaultwave.backend.download;

import com.vaultwave.backend.media.OutputCodec;

public enum DownloadFormat {
    MP3_320(OutputCodec.MP3, 320, 300),
    MP3_192(OutputCodec.MP3, 192, 180),
    FLAC(OutputCodec.FLAC, null, null),
    WAV(OutputCodec.WAV, null, null),
    ORIGINAL_ZIP(null, null, null);

    private final OutputCodec codec;
    private final Integer bitrateKbps;
    // an MP3 source at or above this rate is shipped as-is
    private final Integer reuseThresholdKbps;

    DownloadFormat(OutputCodec codec, Integer bitrateKbps, Integer reuseThresholdKbps) {
        this.codec = codec;
        this.bitrateKbps = bitrateKbps;
        this.reuseThresholdKbps = reuseThresholdKbps;
    }

    public OutputCodec codec() {
        return codec;
    }

    public Integer bitrateKbps() {
        return bitrateKbps;
    }

    public Integer reuseThresholdKbps() {
        return reuseThresholdKbps;
    }

    public boolean isLossy() {
        return codec == OutputCodec.MP3;
    }
}
