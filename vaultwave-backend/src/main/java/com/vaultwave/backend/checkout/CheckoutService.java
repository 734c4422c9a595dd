package com.vaultwave.backend.checkout;

import com.vaultwave.backend.checkout.dto.CheckoutRequest;
import com.vaultwave.backend.checkout.dto.CheckoutResult;
import com.vaultwave.backend.user.User;

public interface CheckoutService {
    CheckoutResult checkout(User user, CheckoutRequest request);
}
