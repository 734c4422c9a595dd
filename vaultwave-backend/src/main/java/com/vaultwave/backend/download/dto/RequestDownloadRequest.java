package com.vaultwave.backend.download.dto;

import com.vaultwave.backend.download.DownloadFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RequestDownloadRequest {
    @NotNull
    private DownloadFormat format;
}
