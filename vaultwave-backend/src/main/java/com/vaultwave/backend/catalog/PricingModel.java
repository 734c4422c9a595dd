package com.vaultwave.backend.catalog;

public enum PricingModel {
    FREE,
    PAID,
    NAME_YOUR_PRICE
}
