package com.vaultwave.backend.checkout.dto;

import lombok.Data;

@Data
public class CheckoutRequest {
    // when true the payment session is opened right away, saving a round trip to /pay
    private boolean startPayment;
}
