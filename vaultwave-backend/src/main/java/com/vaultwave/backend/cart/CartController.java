package com.vaultwave.backend.cart;

import com.vaultwave.backend.cart.dto.AddCartItemRequest;
import com.vaultwave.backend.cart.dto.CartDto;
import com.vaultwave.backend.user.CurrentUserService;
import com.vaultwave.backend.user.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/cart")
@RequiredArgsConstructor
public class CartController {

    private final CartService cartService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public CartDto get() {
        return CartDto.from(cartService.view(currentUserService.getCurrentUserOrThrow()));
    }

    @PostMapping("/items")
    public CartDto add(@Valid @RequestBody AddCartItemRequest request) {
        User user = currentUserService.getCurrentUserOrThrow();
        return CartDto.from(cartService.addItem(user, request.getProductId(), request.getPriceOverride()));
    }

    @DeleteMapping("/items/{productId}")
    public CartDto remove(@PathVariable Long productId) {
        return CartDto.from(cartService.removeItem(currentUserService.getCurrentUserOrThrow(), productId));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        cartService.clear(currentUserService.getCurrentUserOrThrow());
        return ResponseEntity.noContent().build();
    }
}
