package com.vaultwave.backend.media;

public enum OutputCodec {
    MP3("mp3", "libmp3lame"),
    FLAC("flac", "flac"),
    WAV("wav", "pcm_s16le");

    private final String extension;
    private final String ffmpegEncoder;

    OutputCodec(String extension, String ffmpegEncoder) {
        this.extension = extension;
        this.ffmpegEncoder = ffmpegEncoder;
    }

    public String extension() {
        return extension;
    }

    public String ffmpegEncoder() {
        return ffmpegEncoder;
    }
}
