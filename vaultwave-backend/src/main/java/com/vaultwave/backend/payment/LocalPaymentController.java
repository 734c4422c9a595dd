package com.vaultwave.backend.payment;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Approval page of the local provider: approving captures the intent and sends the browser
 * back through the normal return endpoint, the same way a hosted checkout would.
 */
@RestController
@RequestMapping("/api/payments/local")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.payments.provider", havingValue = "local", matchIfMissing = true)
public class LocalPaymentController {

    private final LocalPaymentProviderClient localProvider;

    @Value("${app.payments.return-url:http://localhost:8080/api/payments/return}")
    private String returnUrl;

    @GetMapping("/approve")
    public ResponseEntity<Void> approve(@RequestParam("token") String token,
                                        @RequestParam(value = "decline", defaultValue = "false") boolean decline) {
        if (decline) {
            localProvider.deny(token);
        } else {
            localProvider.capture(token);
        }
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, returnUrl + "?token=" + token)
                .build();
    }
}
