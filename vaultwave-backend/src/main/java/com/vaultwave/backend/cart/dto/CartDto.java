package com.vaultwave.backend.cart.dto;

import com.vaultwave.backend.cart.CartLine;
import com.vaultwave.backend.cart.CartView;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record CartDto(Long id, List<Item> items, BigDecimal total, String currency) {

    public record Item(
            Long productId,
            Long releaseId,
            String name,
            String pricingModel,
            BigDecimal priceOverride,
            BigDecimal price,
            String currency,
            boolean available,
            Instant addedAt
    ) {}

    public static CartDto from(CartView view) {
        return new CartDto(
                view.cartId(),
                view.lines().stream().map(CartDto::item).toList(),
                view.total(),
                view.currency()
        );
    }

    private static Item item(CartLine line) {
        var product = line.product();
        return new Item(
                product.getId(),
                product.getRelease() != null ? product.getRelease().getId() : null,
                product.getName(),
                product.getPricingModel() != null ? product.getPricingModel().name() : null,
                line.item().getPriceOverride(),
                line.available() ? line.price().amount() : null,
                line.available() ? line.price().currency() : product.getCurrency(),
                line.available(),
                line.item().getAddedAt()
        );
    }
}
