package com.vaultwave.backend.catalog;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Sellable wrapper around a release.
 *
 * <p>PAID products carry a base price above zero and a currency; NAME_YOUR_PRICE products carry
 * a currency and a non-negative minimum. FREE products need neither.
 */
@Entity
@Data
@ToString(exclude = "release")
@EqualsAndHashCode(exclude = "release")
@Table(name = "products")
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "release_id", unique = true)
    private Release release;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PricingModel pricingModel;

    @Column(precision = 12, scale = 2)
    private BigDecimal basePrice;

    @Column(length = 3)
    private String currency;

    @Column(precision = 12, scale = 2)
    private BigDecimal minimumPrice = BigDecimal.ZERO;

    private boolean active = true;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
