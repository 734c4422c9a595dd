package com.vaultwave.backend.cart.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AddCartItemRequest {
    @NotNull
    private Long productId;
    // name-your-price amount as typed by the buyer, e.g. "5.00"
    private String priceOverride;
}
