package com.vaultwave.backend.checkout;

import com.vaultwave.backend.checkout.dto.CheckoutRequest;
import com.vaultwave.backend.checkout.dto.CheckoutResult;
import com.vaultwave.backend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CurrentUserService currentUserService;

    @PostMapping
    public ResponseEntity<CheckoutResult> checkout(@RequestBody(required = false) CheckoutRequest request) {
        CheckoutResult result = checkoutService.checkout(
                currentUserService.getCurrentUserOrThrow(),
                request != null ? request : new CheckoutRequest()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
