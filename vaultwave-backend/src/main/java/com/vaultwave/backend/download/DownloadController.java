package com.vaultwave.backend.download;

import com.vaultwave.backend.download.dto.DownloadJobDto;
import com.vaultwave.backend.download.dto.RequestDownloadRequest;
import com.vaultwave.backend.user.CurrentUserService;
import com.vaultwave.backend.user.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadJobService downloadJobService;
    private final CurrentUserService currentUserService;

    @PostMapping("/releases/{releaseId}/request-download")
    public ResponseEntity<DownloadJobDto> requestDownload(@PathVariable Long releaseId,
                                                          @Valid @RequestBody RequestDownloadRequest request) {
        User user = currentUserService.getCurrentUserOrThrow();
        JobRequestResult result = downloadJobService.request(user, releaseId, request.getFormat());
        return ResponseEntity.status(result.created() ? HttpStatus.ACCEPTED : HttpStatus.OK)
                .body(DownloadJobDto.from(result.job()));
    }

    @GetMapping("/download-jobs")
    public List<DownloadJobDto> list() {
        return downloadJobService.list(currentUserService.getCurrentUserOrThrow()).stream()
                .map(DownloadJobDto::from)
                .toList();
    }

    @GetMapping("/download-jobs/{id}")
    public DownloadJobDto status(@PathVariable Long id) {
        return DownloadJobDto.from(downloadJobService.status(currentUserService.getCurrentUserOrThrow(), id));
    }

    @GetMapping("/download-jobs/{id}/artifact")
    public ResponseEntity<Resource> artifact(@PathVariable Long id) {
        DownloadArtifact artifact = downloadJobService.fetchArtifact(currentUserService.getCurrentUserOrThrow(), id);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(artifact.filename(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(artifact.resource());
    }
}
