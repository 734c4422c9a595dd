package com.vaultwave.backend.order.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class CreateOrderRequest {

    @Valid
    private List<Item> items;

    @Data
    public static class Item {
        @NotNull
        private Long productId;
        private String priceOverride;   // name-your-price only, as typed by the buyer
        @Min(1)
        private Integer quantity;
    }
}
