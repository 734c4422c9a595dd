package com.vaultwave.backend.library;

import com.vaultwave.backend.library.dto.LibraryEntryDto;
import com.vaultwave.backend.user.CurrentUserService;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/library")
@RequiredArgsConstructor
public class LibraryController {

    private final LibraryService libraryService;
    private final EntitlementGrantor entitlementGrantor;
    private final CurrentUserService currentUserService;

    @GetMapping
    public List<LibraryEntryDto> list() {
        return libraryService.list(currentUserService.getCurrentUserOrThrow());
    }

    @PostMapping("/releases/{releaseId}")
    public ResponseEntity<LibraryEntryDto> acquireFree(@PathVariable Long releaseId) {
        User user = currentUserService.getCurrentUserOrThrow();
        LibraryEntry entry = entitlementGrantor.acquireFree(user, releaseId);
        return ResponseEntity.status(HttpStatus.CREATED).body(LibraryEntryDto.from(entry));
    }

    @DeleteMapping("/{entryId}")
    public ResponseEntity<Void> remove(@PathVariable Long entryId) {
        libraryService.remove(currentUserService.getCurrentUserOrThrow(), entryId);
        return ResponseEntity.noContent().build();
    }
}
