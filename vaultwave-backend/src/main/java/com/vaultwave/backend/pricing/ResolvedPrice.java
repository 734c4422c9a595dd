package com.vaultwave.backend.pricing;

import java.math.BigDecimal;

/**
 * Authoritative charge for one unit of a product. {@code currency} is null only for FREE
 * products that carry no currency of their own.
 */
public record ResolvedPrice(BigDecimal amount, String currency) {

    public boolean isFree() {
        return amount.signum() == 0;
    }
}
