package com.vaultwave.backend.library;

import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.Release;
import com.vaultwave.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's entitlement to one product. At most one row exists per (user, product); the
 * acquisition price and date are never overwritten once written.
 */
@Entity
@Data
@NoArgsConstructor
@ToString(exclude = {"user", "product", "release"})
@EqualsAndHashCode(exclude = {"user", "product", "release"})
@Table(name = "library_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_library_user_product", columnNames = {"user_id", "product_id"}))
public class LibraryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id")
    private Product product;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "release_id")
    private Release release;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AcquisitionType acquisitionType;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal pricePaid;

    @Column(length = 3)
    private String currency;

    // null for free acquisitions made outside checkout
    private Long sourceOrderId;

    @Column(nullable = false, updatable = false)
    private Instant acquiredAt;

    @PrePersist
    void prePersist() {
        if (acquiredAt == null) acquiredAt = Instant.now();
    }
}
