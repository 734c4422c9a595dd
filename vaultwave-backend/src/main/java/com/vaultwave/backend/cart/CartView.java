package com.vaultwave.backend.cart;

import java.math.BigDecimal;
import java.util.List;

public record CartView(Long cartId, List<CartLine> lines, BigDecimal total, String currency) {
}
