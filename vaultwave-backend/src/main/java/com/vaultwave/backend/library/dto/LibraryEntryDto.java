package com.vaultwave.backend.library.dto;

import com.vaultwave.backend.library.LibraryEntry;

import java.math.BigDecimal;
import java.time.Instant;

public record LibraryEntryDto(
        Long id,
        Long productId,
        Long releaseId,
        String releaseTitle,
        String acquisitionType,
        BigDecimal pricePaid,
        String currency,
        Instant acquiredAt
) {
    public static LibraryEntryDto from(LibraryEntry e) {
        return new LibraryEntryDto(
                e.getId(),
                e.getProduct().getId(),
                e.getRelease().getId(),
                e.getRelease().getTitle(),
                e.getAcquisitionType().name(),
                e.getPricePaid(),
                e.getCurrency(),
                e.getAcquiredAt()
        );
    }
}
