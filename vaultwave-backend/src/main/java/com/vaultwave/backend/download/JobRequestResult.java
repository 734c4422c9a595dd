package com.vaultwave.backend.download;

/**
 * @param created false when an equivalent live job already existed and was returned instead
 */
public record JobRequestResult(GeneratedDownloadJob job, boolean created) {
}
