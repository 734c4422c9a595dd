package com.vaultwave.backend.checkout.dto;

import com.vaultwave.backend.order.dto.OrderDto;
import com.vaultwave.backend.payment.dto.PaymentSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResult {
    private OrderDto order;
    private PaymentSession payment;   // null unless startPayment was requested
}
