package com.vaultwave.backend.order;

import com.vaultwave.backend.catalog.Product;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "order_items")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"order", "product"})
@EqualsAndHashCode(exclude = {"order", "product"})
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id")
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id")
    private Product product;

    @Column(nullable = false, updatable = false)
    private int quantity;

    // unit price frozen at checkout, in the order's currency
    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal priceAtPurchase;

    public BigDecimal lineTotal() {
        return priceAtPurchase.multiply(BigDecimal.valueOf(quantity));
    }
}
