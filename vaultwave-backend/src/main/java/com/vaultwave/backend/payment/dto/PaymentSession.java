package com.vaultwave.backend.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentSession {
    private String provider;          // "local", or "none" for zero-total orders
    private String sessionId;         // provider intent id
    private String paymentUrl;        // approval page the browser is sent to
    private boolean requiresRedirect;
    private Long orderId;
    private String orderStatus;
}
