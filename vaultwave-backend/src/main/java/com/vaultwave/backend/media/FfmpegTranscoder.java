package com.vaultwave.backend.media;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class FfmpegTranscoder implements AudioTranscoder {

    @Value("${app.media.ffmpeg:ffmpeg}")
    private String ffmpegPath;

    @Override
    public void transcode(Path source, Path target, OutputCodec codec, Integer bitrateKbps) throws TranscodeException {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegPath);
        cmd.add("-y");
        cmd.add("-hide_banner");
        cmd.add("-i"); cmd.add(source.toAbsolutePath().toString());
        cmd.add("-vn");
        cmd.add("-c:a"); cmd.add(codec.ffmpegEncoder());
        if (codec == OutputCodec.MP3 && bitrateKbps != null) {
            cmd.add("-b:a"); cmd.add(bitrateKbps + "k");
        }
        cmd.add(target.toAbsolutePath().toString());

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);

        int code;
        StringBuilder tail = new StringBuilder();
        try {
            Process p = pb.start();
            try (BufferedReader br = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = br.readLine()) != null) {
                    log.debug("[ffmpeg] {}", line);
                    tail.append(line).append('\n');
                    if (tail.length() > 2000) tail.delete(0, tail.length() - 2000);
                }
            }
            code = p.waitFor();
        } catch (IOException e) {
            throw new TranscodeException("Could not run ffmpeg at " + ffmpegPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscodeException("Interrupted while transcoding " + source.getFileName(), e);
        }

        if (code != 0) {
            log.warn("ffmpeg exited with {} for {}:\n{}", code, source.getFileName(), tail);
            throw new TranscodeException("ffmpeg failed with exit code " + code + " for " + source.getFileName());
        }
    }
}
