package com.vaultwave.backend.library;

import com.vaultwave.backend.library.dto.LibraryEntryDto;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class LibraryService {

    private final LibraryEntryRepository libraryEntryRepository;

    @Transactional(readOnly = true)
    public List<LibraryEntryDto> list(User user) {
        return libraryEntryRepository.findAllByUserIdOrderByAcquiredAtDesc(user.getId()).stream()
                .map(LibraryEntryDto::from)
                .toList();
    }

    /**
     * Only free acquisitions can be removed; anything paid for stays.
     */
    @Transactional
    public void remove(User user, Long entryId) {
        LibraryEntry entry = libraryEntryRepository.findById(entryId)
                .filter(e -> e.getUser().getId().equals(user.getId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Library item not found"));

        if (entry.getAcquisitionType() != AcquisitionType.FREE) {
            throw new SecurityException("Purchased items cannot be removed from your library");
        }
        libraryEntryRepository.delete(entry);
        log.info("User {} removed free library entry {}", user.getId(), entryId);
    }
}
