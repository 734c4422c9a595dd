package com.vaultwave.backend.payment;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    public static final String SIGNATURE_HEADER = "X-Vaultwave-Signature";

    private final PaymentGatewayAdapter paymentGatewayAdapter;

    @Value("${app.payments.frontend-order-url:http://localhost:5173/orders}")
    private String frontendOrderUrl;

    // Raw body: the signature covers the exact bytes the provider sent
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> webhook(
            @RequestBody String body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature
    ) {
        ReconcileResult result = paymentGatewayAdapter.handleWebhook(body, signature);
        return ResponseEntity.ok(Map.of("outcome", result.outcome().name()));
    }

    @GetMapping("/return")
    public ResponseEntity<Void> paymentReturn(@RequestParam("token") String token) {
        ReconcileResult result = paymentGatewayAdapter.handleReturn(token);

        UriComponentsBuilder target = UriComponentsBuilder.fromUriString(frontendOrderUrl);
        if (result.orderId() != null) {
            target.queryParam("orderId", result.orderId());
        }
        target.queryParam("status", result.orderStatus() != null ? result.orderStatus().name() : "UNKNOWN");

        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, target.build().toUriString())
                .build();
    }
}
