package com.vaultwave.backend.download;

import org.springframework.core.io.Resource;

public record DownloadArtifact(Resource resource, String filename) {
}
