package com.vaultwave.backend.cart;

import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.pricing.ResolvedPrice;

/**
 * A cart item with its current price. {@code price} is null when the product can no longer be
 * priced (deactivated, repriced incorrectly); such lines are left out of the total.
 */
public record CartLine(CartItem item, Product product, ResolvedPrice price) {

    public boolean available() {
        return price != null;
    }
}
