package com.vaultwave.backend.order;

/**
 * One requested line before pricing: a product, the client's raw price override (only used for
 * name-your-price products) and a quantity.
 */
public record OrderLine(Long productId, String priceOverride, int quantity) {

    public static OrderLine of(Long productId, String priceOverride) {
        return new OrderLine(productId, priceOverride, 1);
    }
}
