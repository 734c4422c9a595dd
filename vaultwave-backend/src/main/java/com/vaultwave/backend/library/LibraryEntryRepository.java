package com.vaultwave.backend.library;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface LibraryEntryRepository extends JpaRepository<LibraryEntry, Long> {

    boolean existsByUserIdAndProductId(Long userId, Long productId);

    Optional<LibraryEntry> findByUserIdAndProductId(Long userId, Long productId);

    long countByUserIdAndProductId(Long userId, Long productId);

    List<LibraryEntry> findAllByUserIdOrderByAcquiredAtDesc(Long userId);
}
